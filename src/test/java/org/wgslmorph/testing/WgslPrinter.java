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

package org.wgslmorph.testing;

import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.wgslmorph.ast.AccessMode;
import org.wgslmorph.ast.AddressSpace;
import org.wgslmorph.ast.AstNode;
import org.wgslmorph.ast.Attribute;
import org.wgslmorph.ast.AugmentedExpression;
import org.wgslmorph.ast.AugmentedStatement;
import org.wgslmorph.ast.ContinuingStatement;
import org.wgslmorph.ast.Directive;
import org.wgslmorph.ast.Expression;
import org.wgslmorph.ast.GlobalDecl;
import org.wgslmorph.ast.LhsExpression;
import org.wgslmorph.ast.ParameterDecl;
import org.wgslmorph.ast.Statement;
import org.wgslmorph.ast.StructMember;
import org.wgslmorph.ast.SwitchClause;
import org.wgslmorph.ast.TranslationUnit;
import org.wgslmorph.ast.TypeDecl;

/**
 * Renders syntax trees as WGSL text, two spaces per indentation level. Metadata is not printed;
 * augmented expressions print as their underlying expression in parentheses.
 */
public final class WgslPrinter {

  private final StringBuilder sb = new StringBuilder();
  private int indent;

  private WgslPrinter() {}

  public static String print(AstNode node) {
    WgslPrinter printer = new WgslPrinter();
    printer.node(node);
    return printer.sb.toString();
  }

  private void node(AstNode node) {
    if (node instanceof TranslationUnit tu) {
      for (Directive directive : tu.directives()) {
        sb.append(directive.text()).append('\n');
      }
      for (GlobalDecl decl : tu.globalDecls()) {
        globalDecl(decl);
      }
    } else if (node instanceof GlobalDecl decl) {
      globalDecl(decl);
    } else if (node instanceof Statement statement) {
      statement(statement);
    } else if (node instanceof Expression expression) {
      sb.append(expression(expression));
    } else if (node instanceof LhsExpression lhs) {
      sb.append(lhs(lhs));
    } else if (node instanceof TypeDecl type) {
      sb.append(type(type));
    } else {
      throw new IllegalArgumentException("Cannot print " + node);
    }
  }

  private void line(String text) {
    sb.append("  ".repeat(indent)).append(text).append('\n');
  }

  private void globalDecl(GlobalDecl decl) {
    if (decl instanceof GlobalDecl.Constant c) {
      line(
          "const " + c.name() + optionalType(c.type()) + " = " + expression(c.initializer()) + ";");
    } else if (decl instanceof GlobalDecl.OverrideConstant o) {
      line(
          attributes(o.attributes())
              + "override "
              + o.name()
              + optionalType(o.type())
              + (o.initializer() == null ? "" : " = " + expression(o.initializer()))
              + ";");
    } else if (decl instanceof GlobalDecl.Variable v) {
      line(
          attributes(v.attributes())
              + "var"
              + addressSpace(v.addressSpace(), v.accessMode())
              + " "
              + v.name()
              + optionalType(v.type())
              + (v.initializer() == null ? "" : " = " + expression(v.initializer()))
              + ";");
    } else if (decl instanceof GlobalDecl.Function f) {
      String params =
          f.parameters().stream().map(WgslPrinter::parameter).collect(Collectors.joining(", "));
      String result =
          f.returnType() == null
              ? ""
              : " -> " + attributes(f.returnAttributes()) + type(f.returnType());
      sb.append("  ".repeat(indent))
          .append(attributes(f.attributes()))
          .append("fn ")
          .append(f.name())
          .append('(')
          .append(params)
          .append(')')
          .append(result)
          .append(' ');
      compoundBody(f.body());
      sb.append('\n');
    } else if (decl instanceof GlobalDecl.Struct s) {
      line("struct " + s.name() + " {");
      indent++;
      for (StructMember member : s.members()) {
        line(attributes(member.attributes()) + member.name() + ": " + type(member.type()) + ",");
      }
      indent--;
      line("}");
    } else if (decl instanceof GlobalDecl.TypeAlias t) {
      line("alias " + t.name() + " = " + type(t.type()) + ";");
    } else if (decl instanceof GlobalDecl.ConstAssert c) {
      line("const_assert " + expression(c.expression()) + ";");
    } else if (decl instanceof GlobalDecl.Empty) {
      line(";");
    }
  }

  private static String parameter(ParameterDecl p) {
    return attributes(p.attributes()) + p.name() + ": " + type(p.typeDecl());
  }

  private static String optionalType(@Nullable TypeDecl type) {
    return type == null ? "" : ": " + type(type);
  }

  private static String addressSpace(
      @Nullable AddressSpace addressSpace, @Nullable AccessMode accessMode) {
    if (addressSpace == null) {
      return "";
    }
    return accessMode == null
        ? "<" + addressSpace.wgslName + ">"
        : "<" + addressSpace.wgslName + ", " + accessMode.wgslName + ">";
  }

  private static String attributes(List<Attribute> attributes) {
    StringBuilder result = new StringBuilder();
    for (Attribute attribute : attributes) {
      result.append(attribute(attribute)).append(' ');
    }
    return result.toString();
  }

  private static String attribute(Attribute a) {
    if (a instanceof Attribute.Align x) {
      return "@align(" + expression(x.expression()) + ")";
    } else if (a instanceof Attribute.Binding x) {
      return "@binding(" + expression(x.expression()) + ")";
    } else if (a instanceof Attribute.BlendSrc x) {
      return "@blend_src(" + expression(x.expression()) + ")";
    } else if (a instanceof Attribute.Builtin x) {
      return "@builtin(" + x.name() + ")";
    } else if (a instanceof Attribute.Compute) {
      return "@compute";
    } else if (a instanceof Attribute.Const) {
      return "@const";
    } else if (a instanceof Attribute.Diagnostic x) {
      return "@diagnostic(" + x.severity() + ", " + x.rule() + ")";
    } else if (a instanceof Attribute.Fragment) {
      return "@fragment";
    } else if (a instanceof Attribute.Group x) {
      return "@group(" + expression(x.expression()) + ")";
    } else if (a instanceof Attribute.Id x) {
      return "@id(" + expression(x.expression()) + ")";
    } else if (a instanceof Attribute.Interpolate x) {
      return "@interpolate(" + x.type() + (x.sampling() == null ? "" : ", " + x.sampling()) + ")";
    } else if (a instanceof Attribute.Invariant) {
      return "@invariant";
    } else if (a instanceof Attribute.Location x) {
      return "@location(" + expression(x.expression()) + ")";
    } else if (a instanceof Attribute.MustUse) {
      return "@must_use";
    } else if (a instanceof Attribute.Size x) {
      return "@size(" + expression(x.expression()) + ")";
    } else if (a instanceof Attribute.Vertex) {
      return "@vertex";
    } else if (a instanceof Attribute.WorkgroupSize x) {
      StringBuilder result = new StringBuilder("@workgroup_size(").append(expression(x.sizeX()));
      if (x.sizeY() != null) {
        result.append(", ").append(expression(x.sizeY()));
      }
      if (x.sizeZ() != null) {
        result.append(", ").append(expression(x.sizeZ()));
      }
      return result.append(')').toString();
    }
    throw new IllegalArgumentException("Unknown attribute " + a);
  }

  /** Prints {@code { ... }} starting at the current position, leaving the cursor after "}". */
  private void compoundBody(Statement.Compound compound) {
    sb.append("{\n");
    indent++;
    for (Statement statement : compound.statements()) {
      statement(statement);
    }
    indent--;
    sb.append("  ".repeat(indent)).append('}');
  }

  private void statement(Statement statement) {
    if (statement instanceof Statement.Compound c) {
      sb.append("  ".repeat(indent));
      compoundBody(c);
      sb.append('\n');
    } else if (statement instanceof Statement.If i) {
      sb.append("  ".repeat(indent));
      ifChain(i);
      sb.append('\n');
    } else if (statement instanceof Statement.Switch s) {
      line("switch " + expression(s.expression()) + " {");
      indent++;
      for (SwitchClause clause : s.clauses()) {
        sb.append("  ".repeat(indent)).append(clauseHead(clause)).append(' ');
        compoundBody(clause.compoundStatement());
        sb.append('\n');
      }
      indent--;
      line("}");
    } else if (statement instanceof Statement.Loop l) {
      line("loop {");
      indent++;
      for (Statement s : l.body().statements()) {
        statement(s);
      }
      ContinuingStatement continuing = l.continuingStatement();
      if (continuing != null) {
        line("continuing {");
        indent++;
        for (Statement s : continuing.statements().statements()) {
          statement(s);
        }
        if (continuing.breakIfExpr() != null) {
          line("break if " + expression(continuing.breakIfExpr()) + ";");
        }
        indent--;
        line("}");
      }
      indent--;
      line("}");
    } else if (statement instanceof Statement.For f) {
      sb.append("  ".repeat(indent))
          .append("for (")
          .append(f.init() == null ? "" : simpleStatement(f.init()))
          .append("; ")
          .append(f.condition() == null ? "" : expression(f.condition()))
          .append("; ")
          .append(f.update() == null ? "" : simpleStatement(f.update()))
          .append(") ");
      compoundBody(f.body());
      sb.append('\n');
    } else if (statement instanceof Statement.While w) {
      sb.append("  ".repeat(indent))
          .append("while ")
          .append(expression(w.condition()))
          .append(' ');
      compoundBody(w.body());
      sb.append('\n');
    } else if (statement instanceof AugmentedStatement.DeadCodeFragment d) {
      statement(d.statement());
    } else if (statement instanceof AugmentedStatement.ControlFlowWrapper w) {
      statement(w.statement());
    } else if (statement instanceof AugmentedStatement.ControlFlowWrapReturn r) {
      statement(r.returnStatement());
    } else {
      line(simpleStatement(statement) + ";");
    }
  }

  private void ifChain(Statement.If i) {
    sb.append("if ").append(expression(i.condition())).append(' ');
    compoundBody(i.thenBranch());
    Statement.ElseBranch elseBranch = i.elseBranch();
    if (elseBranch instanceof Statement.If elseIf) {
      sb.append(" else ");
      ifChain(elseIf);
    } else if (elseBranch instanceof Statement.Compound c) {
      sb.append(" else ");
      compoundBody(c);
    }
  }

  private static String clauseHead(SwitchClause clause) {
    String selectors =
        clause.caseSelectors().stream()
            .map(WgslPrinter::expression)
            .collect(Collectors.joining(", "));
    if (clause.includesDefault()) {
      return selectors.isEmpty() ? "default:" : "case " + selectors + ", default:";
    }
    return "case " + selectors + ":";
  }

  /** Statements that print on one line without their trailing semicolon. */
  private static String simpleStatement(Statement statement) {
    if (statement instanceof Statement.Empty) {
      return "";
    } else if (statement instanceof Statement.Break) {
      return "break";
    } else if (statement instanceof Statement.Continue) {
      return "continue";
    } else if (statement instanceof Statement.Discard) {
      return "discard";
    } else if (statement instanceof Statement.Return r) {
      return r.expression() == null ? "return" : "return " + expression(r.expression());
    } else if (statement instanceof Statement.Assignment a) {
      String target = a.lhsExpression() == null ? "_" : lhs(a.lhsExpression());
      return target + " " + a.assignmentOperator().token + " " + expression(a.rhs());
    } else if (statement instanceof Statement.Increment i) {
      return lhs(i.target()) + "++";
    } else if (statement instanceof Statement.Decrement d) {
      return lhs(d.target()) + "--";
    } else if (statement instanceof Statement.ConstAssert c) {
      return "const_assert " + expression(c.expression());
    } else if (statement instanceof Statement.FunctionCall call) {
      return call.callee() + args(call.args());
    } else if (statement instanceof Statement.Value v) {
      return (v.isConst() ? "const " : "let ")
          + v.name()
          + optionalType(v.type())
          + " = "
          + expression(v.initializer());
    } else if (statement instanceof Statement.Variable v) {
      return "var"
          + addressSpace(v.addressSpace(), v.accessMode())
          + " "
          + v.name()
          + optionalType(v.type())
          + (v.initializer() == null ? "" : " = " + expression(v.initializer()));
    }
    throw new IllegalArgumentException("Not a simple statement: " + statement);
  }

  private static String args(List<Expression> args) {
    return args.stream().map(WgslPrinter::expression).collect(Collectors.joining(", ", "(", ")"));
  }

  public static String expression(Expression e) {
    if (e instanceof Expression.BoolLiteral b) {
      return b.text();
    } else if (e instanceof Expression.IntLiteral i) {
      return i.text();
    } else if (e instanceof Expression.FloatLiteral f) {
      return f.text();
    } else if (e instanceof Expression.Identifier id) {
      return id.name();
    } else if (e instanceof Expression.Paren p) {
      return "(" + expression(p.target()) + ")";
    } else if (e instanceof Expression.Unary u) {
      return u.operator().token + expression(u.target());
    } else if (e instanceof Expression.Binary b) {
      return expression(b.lhs()) + " " + b.operator().token + " " + expression(b.rhs());
    } else if (e instanceof Expression.FunctionCall call) {
      String template =
          call.templateParameter() == null ? "" : "<" + type(call.templateParameter()) + ">";
      return call.callee() + template + args(call.args());
    } else if (e instanceof Expression.ScalarValueConstructor c) {
      return type(c.scalarType()) + args(c.args());
    } else if (e instanceof Expression.VectorValueConstructor c) {
      return "vec"
          + c.width()
          + (c.elementType() == null ? "" : "<" + type(c.elementType()) + ">")
          + args(c.args());
    } else if (e instanceof Expression.MatrixValueConstructor c) {
      return "mat"
          + c.numCols()
          + "x"
          + c.numRows()
          + (c.elementType() == null ? "" : "<" + type(c.elementType()) + ">")
          + args(c.args());
    } else if (e instanceof Expression.ArrayValueConstructor c) {
      String template = "";
      if (c.elementType() != null) {
        template =
            "<"
                + type(c.elementType())
                + (c.elementCount() == null ? "" : ", " + expression(c.elementCount()))
                + ">";
      }
      return "array" + template + args(c.args());
    } else if (e instanceof Expression.StructValueConstructor c) {
      return c.structName() + args(c.args());
    } else if (e instanceof Expression.TypeAliasValueConstructor c) {
      return c.typeName() + args(c.args());
    } else if (e instanceof Expression.MemberLookup m) {
      return expression(m.receiver()) + "." + m.memberName();
    } else if (e instanceof Expression.IndexLookup i) {
      return expression(i.target()) + "[" + expression(i.index()) + "]";
    } else if (e instanceof AugmentedExpression.KnownValue kv) {
      return "(" + expression(kv.expression()) + ")";
    } else if (e instanceof AugmentedExpression.ArbitraryExpression a) {
      return "(" + expression(a.expression()) + ")";
    }
    throw new IllegalArgumentException("Unknown expression " + e);
  }

  private static String lhs(LhsExpression lhs) {
    if (lhs instanceof LhsExpression.Identifier id) {
      return id.name();
    } else if (lhs instanceof LhsExpression.Paren p) {
      return "(" + lhs(p.target()) + ")";
    } else if (lhs instanceof LhsExpression.MemberLookup m) {
      return lhs(m.receiver()) + "." + m.memberName();
    } else if (lhs instanceof LhsExpression.IndexLookup i) {
      return lhs(i.target()) + "[" + expression(i.index()) + "]";
    } else if (lhs instanceof LhsExpression.Dereference d) {
      return "*" + lhs(d.target());
    } else if (lhs instanceof LhsExpression.AddressOf a) {
      return "&" + lhs(a.target());
    }
    throw new IllegalArgumentException("Unknown lhs " + lhs);
  }

  public static String type(TypeDecl type) {
    if (type instanceof TypeDecl.Bool) {
      return "bool";
    } else if (type instanceof TypeDecl.I32) {
      return "i32";
    } else if (type instanceof TypeDecl.U32) {
      return "u32";
    } else if (type instanceof TypeDecl.F16) {
      return "f16";
    } else if (type instanceof TypeDecl.F32) {
      return "f32";
    } else if (type instanceof TypeDecl.Vector v) {
      return "vec" + v.width() + "<" + type(v.elementType()) + ">";
    } else if (type instanceof TypeDecl.Matrix m) {
      return "mat" + m.numCols() + "x" + m.numRows() + "<" + type(m.elementType()) + ">";
    } else if (type instanceof TypeDecl.Array a) {
      return "array<"
          + type(a.elementType())
          + (a.elementCount() == null ? "" : ", " + expression(a.elementCount()))
          + ">";
    } else if (type instanceof TypeDecl.NamedType n) {
      return n.name();
    } else if (type instanceof TypeDecl.Pointer p) {
      return "ptr<"
          + p.addressSpace().wgslName
          + ", "
          + type(p.pointeeType())
          + (p.accessMode() == null ? "" : ", " + p.accessMode().wgslName)
          + ">";
    } else if (type instanceof TypeDecl.Atomic a) {
      return "atomic<" + type(a.targetType()) + ">";
    } else if (type instanceof TypeDecl.SamplerRegular) {
      return "sampler";
    } else if (type instanceof TypeDecl.SamplerComparison) {
      return "sampler_comparison";
    } else if (type instanceof TypeDecl.SampledTexture t) {
      return t.kind().wgslName + "<" + type(t.sampledType()) + ">";
    } else if (type instanceof TypeDecl.DepthTexture t) {
      return t.kind().wgslName;
    } else if (type instanceof TypeDecl.StorageTexture t) {
      return t.kind().wgslName
          + "<"
          + t.texelFormat()
          + ", "
          + t.accessMode().wgslName
          + ">";
    } else if (type instanceof TypeDecl.ExternalTexture) {
      return "texture_external";
    }
    throw new IllegalArgumentException("Unknown type " + type);
  }
}
