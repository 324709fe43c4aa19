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

package org.wgslmorph.resolve;

import org.wgslmorph.ast.AstNode;
import org.wgslmorph.ast.GlobalDecl;
import org.wgslmorph.ast.ParameterDecl;
import org.wgslmorph.ast.Statement;

/** A declaration visible in a {@link Scope}, with its resolved type. */
public sealed interface ScopeEntry {

  /** The declaring node. */
  AstNode astNode();

  String declName();

  record Function(GlobalDecl.Function astNode, FunctionType type) implements ScopeEntry {
    @Override
    public String declName() {
      return astNode.name();
    }
  }

  /** An entry that names a value or a type. */
  sealed interface TypedDecl extends ScopeEntry {
    Type type();
  }

  record Parameter(ParameterDecl astNode, Type type) implements TypedDecl {
    @Override
    public String declName() {
      return astNode.name();
    }
  }

  record LocalVariable(Statement.Variable astNode, Type type) implements TypedDecl {
    @Override
    public String declName() {
      return astNode.name();
    }
  }

  record LocalValue(Statement.Value astNode, Type type) implements TypedDecl {
    @Override
    public String declName() {
      return astNode.name();
    }
  }

  record GlobalVariable(GlobalDecl.Variable astNode, Type type) implements TypedDecl {
    @Override
    public String declName() {
      return astNode.name();
    }
  }

  record GlobalConstant(GlobalDecl.Constant astNode, Type type) implements TypedDecl {
    @Override
    public String declName() {
      return astNode.name();
    }
  }

  record GlobalOverride(GlobalDecl.OverrideConstant astNode, Type type) implements TypedDecl {
    @Override
    public String declName() {
      return astNode.name();
    }
  }

  record Struct(GlobalDecl.Struct astNode, Type.Struct type) implements TypedDecl {
    @Override
    public String declName() {
      return astNode.name();
    }
  }

  record TypeAlias(GlobalDecl.TypeAlias astNode, Type type) implements TypedDecl {
    @Override
    public String declName() {
      return astNode.name();
    }
  }
}
