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

/**
 * The root of the syntax tree hierarchy. Every node is an immutable value: passes never modify a
 * tree, they rebuild it with {@link AstCloner}.
 *
 * <p>Nodes are records, so {@code equals()} compares structure. Any table that records a decision
 * about a specific node must therefore be keyed by identity (e.g. an {@link
 * java.util.IdentityHashMap}); two empty compounds are equal but are not the same node.
 */
public sealed interface AstNode
    permits TranslationUnit,
        Directive,
        Attribute,
        GlobalDecl,
        ParameterDecl,
        StructMember,
        TypeDecl,
        Expression,
        LhsExpression,
        Statement,
        ContinuingStatement,
        SwitchClause {}
