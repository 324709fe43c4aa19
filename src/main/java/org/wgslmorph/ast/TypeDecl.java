/*
 * Copyright 2025 The WgslMorph Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.wgslmorph.ast;

import org.jspecify.annotations.Nullable;

/**
 * Types as written in source. These are syntactic: a {@link NamedType} may denote a struct, an
 * alias or a predeclared alias such as {@code vec4f}, and only the resolver knows which. The
 * semantic counterpart is {@link org.wgslmorph.resolve.Type}.
 */
public sealed interface TypeDecl extends AstNode {

  sealed interface ScalarTypeDecl extends TypeDecl {
    /** The keyword that names this type. */
    String wgslName();
  }

  record Bool() implements ScalarTypeDecl {
    @Override
    public String wgslName() {
      return "bool";
    }
  }

  record I32() implements ScalarTypeDecl {
    @Override
    public String wgslName() {
      return "i32";
    }
  }

  record U32() implements ScalarTypeDecl {
    @Override
    public String wgslName() {
      return "u32";
    }
  }

  record F16() implements ScalarTypeDecl {
    @Override
    public String wgslName() {
      return "f16";
    }
  }

  record F32() implements ScalarTypeDecl {
    @Override
    public String wgslName() {
      return "f32";
    }
  }

  /** {@code vecN<elementType>}; width is 2, 3 or 4. */
  record Vector(int width, ScalarTypeDecl elementType) implements TypeDecl {}

  /** {@code matCxR<elementType>}. */
  record Matrix(int numCols, int numRows, ScalarTypeDecl elementType) implements TypeDecl {}

  /** {@code array<elementType, elementCount>}; a null count denotes a runtime-sized array. */
  record Array(TypeDecl elementType, @Nullable Expression elementCount) implements TypeDecl {}

  record NamedType(String name) implements TypeDecl {}

  record Pointer(AddressSpace addressSpace, TypeDecl pointeeType, @Nullable AccessMode accessMode)
      implements TypeDecl {}

  record Atomic(TypeDecl targetType) implements TypeDecl {}

  record SamplerRegular() implements TypeDecl {}

  record SamplerComparison() implements TypeDecl {}

  enum SampledTextureKind {
    TEXTURE_1D("texture_1d"),
    TEXTURE_2D("texture_2d"),
    TEXTURE_2D_ARRAY("texture_2d_array"),
    TEXTURE_3D("texture_3d"),
    TEXTURE_CUBE("texture_cube"),
    TEXTURE_CUBE_ARRAY("texture_cube_array"),
    TEXTURE_MULTISAMPLED_2D("texture_multisampled_2d");

    public final String wgslName;

    SampledTextureKind(String wgslName) {
      this.wgslName = wgslName;
    }
  }

  record SampledTexture(SampledTextureKind kind, TypeDecl sampledType) implements TypeDecl {}

  enum DepthTextureKind {
    TEXTURE_DEPTH_2D("texture_depth_2d"),
    TEXTURE_DEPTH_2D_ARRAY("texture_depth_2d_array"),
    TEXTURE_DEPTH_CUBE("texture_depth_cube"),
    TEXTURE_DEPTH_CUBE_ARRAY("texture_depth_cube_array"),
    TEXTURE_DEPTH_MULTISAMPLED_2D("texture_depth_multisampled_2d");

    public final String wgslName;

    DepthTextureKind(String wgslName) {
      this.wgslName = wgslName;
    }
  }

  record DepthTexture(DepthTextureKind kind) implements TypeDecl {}

  enum StorageTextureKind {
    TEXTURE_STORAGE_1D("texture_storage_1d"),
    TEXTURE_STORAGE_2D("texture_storage_2d"),
    TEXTURE_STORAGE_2D_ARRAY("texture_storage_2d_array"),
    TEXTURE_STORAGE_3D("texture_storage_3d");

    public final String wgslName;

    StorageTextureKind(String wgslName) {
      this.wgslName = wgslName;
    }
  }

  record StorageTexture(StorageTextureKind kind, String texelFormat, AccessMode accessMode)
      implements TypeDecl {}

  record ExternalTexture() implements TypeDecl {}
}
