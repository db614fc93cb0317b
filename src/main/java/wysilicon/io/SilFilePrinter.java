// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package wysilicon.io;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import wysilicon.core.SilFile;
import wysilicon.core.SilFile.Decl;
import wysilicon.core.SilFile.Expr;
import wysilicon.core.SilFile.Stmt;
import wysilicon.core.SilFile.Type;

/**
 * Writes programs (or fragments thereof) in the usual concrete syntax of the
 * intermediate verification language, e.g. for reporting errors.
 */
public class SilFilePrinter {
	private final PrintWriter out;

	public SilFilePrinter(OutputStream output) {
		this.out = new PrintWriter(output, false, StandardCharsets.UTF_8);
	}

	public void flush() {
		out.flush();
	}

	public void write(SilFile file) {
		for (Decl d : file.getDeclarations()) {
			writeDecl(0, d);
		}
		out.flush();
	}

	/**
	 * Write an arbitrary item. Statements are written on one or more lines,
	 * whilst expressions and types are not terminated by a newline.
	 *
	 * @param item
	 */
	public void write(SilFile.Item item) {
		if (item instanceof Decl) {
			writeDecl(0, (Decl) item);
		} else if (item instanceof Stmt) {
			writeStmt(0, (Stmt) item);
		} else if (item instanceof Expr) {
			writeExpression((Expr) item);
		} else if (item instanceof Type) {
			writeType((Type) item);
		} else {
			throw new IllegalArgumentException("unknown item encountered (" + item.getClass().getName() + ")");
		}
		out.flush();
	}

	private void writeDecl(int indent, Decl d) {
		if (d instanceof Decl.Field) {
			writeField(indent, (Decl.Field) d);
		} else if (d instanceof Decl.Predicate) {
			writePredicate(indent, (Decl.Predicate) d);
		} else if (d instanceof Decl.Method) {
			writeMethod(indent, (Decl.Method) d);
		} else if (d instanceof Decl.Parameter) {
			writeParameter((Decl.Parameter) d);
		} else {
			throw new IllegalArgumentException("unknown declaration encountered (" + d.getClass().getName() + ")");
		}
	}

	private void writeField(int indent, Decl.Field d) {
		tab(indent);
		out.print("field ");
		out.print(d.getName());
		out.print(": ");
		writeType(d.getType());
		out.println();
	}

	private void writePredicate(int indent, Decl.Predicate d) {
		tab(indent);
		out.print("predicate ");
		out.print(d.getName());
		writeParameters(d.getParameters());
		if (d.getBody() == null) {
			out.println();
		} else {
			out.println(" {");
			tab(indent + 1);
			writeExpression(d.getBody());
			out.println();
			tab(indent);
			out.println("}");
		}
	}

	private void writeMethod(int indent, Decl.Method d) {
		tab(indent);
		out.print("method ");
		out.print(d.getName());
		writeParameters(d.getParameters());
		if (!d.getReturns().isEmpty()) {
			out.print(" returns ");
			writeParameters(d.getReturns());
		}
		out.println();
		writeSpecification(indent + 1, "requires ", d.getRequires());
		writeSpecification(indent + 1, "ensures ", d.getEnsures());
		if (d.getBody() != null) {
			tab(indent);
			out.println("{");
			writeStmt(indent + 1, d.getBody());
			tab(indent);
			out.println("}");
		}
	}

	private void writeSpecification(int indent, String kind, List<Expr> clauses) {
		for (Expr clause : clauses) {
			tab(indent);
			out.print(kind);
			writeExpression(clause);
			out.println();
		}
	}

	private void writeParameters(List<Decl.Parameter> parameters) {
		out.print("(");
		for (int i = 0; i != parameters.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeParameter(parameters.get(i));
		}
		out.print(")");
	}

	private void writeParameter(Decl.Parameter p) {
		out.print(p.getName());
		out.print(": ");
		writeType(p.getType());
	}

	private void writeType(Type t) {
		if (t instanceof Type.Bool) {
			out.print("Bool");
		} else if (t instanceof Type.Int) {
			out.print("Int");
		} else if (t instanceof Type.Ref) {
			out.print("Ref");
		} else if (t instanceof Type.Perm) {
			out.print("Perm");
		} else if (t instanceof Type.Wand) {
			out.print("Wand");
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + t.getClass().getName() + ")");
		}
	}

	private void writeStmt(int indent, Stmt s) {
		if (s instanceof Stmt.Sequence) {
			writeSequence(indent, (Stmt.Sequence) s);
		} else if (s instanceof Stmt.LocalAssign) {
			Stmt.LocalAssign a = (Stmt.LocalAssign) s;
			writeSimple(indent, "", a.getLeftHandSide(), " := ", a.getRightHandSide());
		} else if (s instanceof Stmt.FieldWrite) {
			Stmt.FieldWrite a = (Stmt.FieldWrite) s;
			writeSimple(indent, "", a.getLeftHandSide(), " := ", a.getRightHandSide());
		} else if (s instanceof Stmt.New) {
			writeNew(indent, (Stmt.New) s);
		} else if (s instanceof Stmt.Fresh) {
			tab(indent);
			out.print("fresh ");
			writeExpressions(((Stmt.Fresh) s).getVariables());
			out.println();
		} else if (s instanceof Stmt.Inhale) {
			writeSimple(indent, "inhale ", ((Stmt.Inhale) s).getCondition());
		} else if (s instanceof Stmt.Exhale) {
			writeSimple(indent, "exhale ", ((Stmt.Exhale) s).getCondition());
		} else if (s instanceof Stmt.Assert) {
			writeSimple(indent, "assert ", ((Stmt.Assert) s).getCondition());
		} else if (s instanceof Stmt.MethodCall) {
			writeMethodCall(indent, (Stmt.MethodCall) s);
		} else if (s instanceof Stmt.Fold) {
			writeSimple(indent, "fold ", ((Stmt.Fold) s).getPredicate());
		} else if (s instanceof Stmt.Unfold) {
			writeSimple(indent, "unfold ", ((Stmt.Unfold) s).getPredicate());
		} else if (s instanceof Stmt.Package) {
			writeSimple(indent, "package ", ((Stmt.Package) s).getWand());
		} else if (s instanceof Stmt.Apply) {
			writeSimple(indent, "apply ", ((Stmt.Apply) s).getWand());
		} else if (s instanceof Stmt.Constraining) {
			writeConstraining(indent, (Stmt.Constraining) s);
		} else if (s instanceof Stmt.IfElse) {
			writeIfElse(indent, (Stmt.IfElse) s);
		} else if (s instanceof Stmt.While) {
			writeWhile(indent, (Stmt.While) s);
		} else if (s instanceof Stmt.Label) {
			tab(indent);
			out.print("label ");
			out.println(((Stmt.Label) s).getLabel());
		} else if (s instanceof Stmt.Goto) {
			tab(indent);
			out.print("goto ");
			out.println(((Stmt.Goto) s).getLabel());
		} else {
			throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
		}
	}

	private void writeSimple(int indent, String keyword, Expr e) {
		tab(indent);
		out.print(keyword);
		writeExpression(e);
		out.println();
	}

	private void writeSimple(int indent, String keyword, Expr lhs, String op, Expr rhs) {
		tab(indent);
		out.print(keyword);
		writeExpression(lhs);
		out.print(op);
		writeExpression(rhs);
		out.println();
	}

	private void writeSequence(int indent, Stmt.Sequence s) {
		for (int i = 0; i != s.size(); ++i) {
			writeStmt(indent, s.get(i));
		}
	}

	private void writeNew(int indent, Stmt.New s) {
		tab(indent);
		writeExpression(s.getLeftHandSide());
		out.print(" := new(");
		List<Decl.Field> fields = s.getFields();
		for (int i = 0; i != fields.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			out.print(fields.get(i).getName());
		}
		out.println(")");
	}

	private void writeMethodCall(int indent, Stmt.MethodCall s) {
		tab(indent);
		if (!s.getTargets().isEmpty()) {
			writeExpressions(s.getTargets());
			out.print(" := ");
		}
		out.print(s.getName());
		out.print("(");
		writeExpressions(s.getArguments());
		out.println(")");
	}

	private void writeConstraining(int indent, Stmt.Constraining s) {
		tab(indent);
		out.print("constraining(");
		writeExpressions(s.getVariables());
		out.println(") {");
		writeStmt(indent + 1, s.getBody());
		tab(indent);
		out.println("}");
	}

	private void writeIfElse(int indent, Stmt.IfElse s) {
		tab(indent);
		out.print("if (");
		writeExpression(s.getCondition());
		out.println(") {");
		writeStmt(indent + 1, s.getTrueBranch());
		if (s.getFalseBranch() != null) {
			tab(indent);
			out.println("} else {");
			writeStmt(indent + 1, s.getFalseBranch());
		}
		tab(indent);
		out.println("}");
	}

	private void writeWhile(int indent, Stmt.While s) {
		tab(indent);
		out.print("while (");
		writeExpression(s.getCondition());
		out.println(")");
		writeSpecification(indent + 1, "invariant ", s.getInvariant());
		tab(indent);
		out.println("{");
		writeStmt(indent + 1, s.getBody());
		tab(indent);
		out.println("}");
	}

	private void writeExpressions(List<? extends Expr> es) {
		for (int i = 0; i != es.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeExpression(es.get(i));
		}
	}

	private void writeExpressionWithBraces(Expr e) {
		if (e instanceof Expr.UnaryOperator || e instanceof Expr.BinaryOperator || e instanceof Expr.NaryOperator) {
			out.print("(");
			writeExpression(e);
			out.print(")");
		} else {
			writeExpression(e);
		}
	}

	private void writeExpression(Expr e) {
		if (e instanceof Expr.Equals) {
			writeInfix((Expr.BinaryOperator) e, " == ");
		} else if (e instanceof Expr.NotEquals) {
			writeInfix((Expr.BinaryOperator) e, " != ");
		} else if (e instanceof Expr.LessThan) {
			writeInfix((Expr.BinaryOperator) e, " < ");
		} else if (e instanceof Expr.LessThanOrEqual) {
			writeInfix((Expr.BinaryOperator) e, " <= ");
		} else if (e instanceof Expr.GreaterThan) {
			writeInfix((Expr.BinaryOperator) e, " > ");
		} else if (e instanceof Expr.GreaterThanOrEqual) {
			writeInfix((Expr.BinaryOperator) e, " >= ");
		} else if (e instanceof Expr.Implies) {
			writeInfix((Expr.BinaryOperator) e, " ==> ");
		} else if (e instanceof Expr.Addition) {
			writeInfix((Expr.BinaryOperator) e, " + ");
		} else if (e instanceof Expr.Subtraction) {
			writeInfix((Expr.BinaryOperator) e, " - ");
		} else if (e instanceof Expr.Multiplication) {
			writeInfix((Expr.BinaryOperator) e, " * ");
		} else if (e instanceof Expr.Division || e instanceof Expr.FractionalPerm) {
			writeInfix((Expr.BinaryOperator) e, " / ");
		} else if (e instanceof Expr.MagicWand) {
			writeInfix((Expr.BinaryOperator) e, " --* ");
		} else if (e instanceof Expr.Boolean) {
			out.print(Boolean.toString(((Expr.Boolean) e).getValue()));
		} else if (e instanceof Expr.Integer) {
			out.print(((Expr.Integer) e).getValue().toString());
		} else if (e instanceof Expr.Null) {
			out.print("null");
		} else if (e instanceof Expr.Negation) {
			out.print("-");
			writeExpressionWithBraces(((Expr.Negation) e).getOperand());
		} else if (e instanceof Expr.LogicalNot) {
			out.print("!");
			writeExpressionWithBraces(((Expr.LogicalNot) e).getOperand());
		} else if (e instanceof Expr.LogicalAnd) {
			writeNary(((Expr.LogicalAnd) e).getOperands(), " && ");
		} else if (e instanceof Expr.LogicalOr) {
			writeNary(((Expr.LogicalOr) e).getOperands(), " || ");
		} else if (e instanceof Expr.Old) {
			writeOld((Expr.Old) e);
		} else if (e instanceof Expr.VariableAccess) {
			out.print(((Expr.VariableAccess) e).getVariable());
		} else if (e instanceof Expr.FieldAccess) {
			Expr.FieldAccess fa = (Expr.FieldAccess) e;
			writeExpressionWithBraces(fa.getReceiver());
			out.print(".");
			out.print(fa.getField().getName());
		} else if (e instanceof Expr.PredicateAccess) {
			Expr.PredicateAccess pa = (Expr.PredicateAccess) e;
			out.print(pa.getName());
			out.print("(");
			writeExpressions(pa.getArguments());
			out.print(")");
		} else if (e instanceof Expr.FullPerm) {
			out.print("write");
		} else if (e instanceof Expr.NoPerm) {
			out.print("none");
		} else if (e instanceof Expr.CurrentPerm) {
			out.print("perm(");
			writeExpression(((Expr.CurrentPerm) e).getLocation());
			out.print(")");
		} else if (e instanceof Expr.FieldAccessPredicate) {
			Expr.FieldAccessPredicate ap = (Expr.FieldAccessPredicate) e;
			writeAccess(ap.getLocation(), ap.getPermission());
		} else if (e instanceof Expr.PredicateAccessPredicate) {
			Expr.PredicateAccessPredicate ap = (Expr.PredicateAccessPredicate) e;
			writeAccess(ap.getLocation(), ap.getPermission());
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeInfix(Expr.BinaryOperator e, String op) {
		writeExpressionWithBraces(e.getLeftHandSide());
		out.print(op);
		writeExpressionWithBraces(e.getRightHandSide());
	}

	private void writeNary(List<Expr> operands, String op) {
		for (int i = 0; i != operands.size(); ++i) {
			if (i != 0) {
				out.print(op);
			}
			writeExpressionWithBraces(operands.get(i));
		}
	}

	private void writeOld(Expr.Old e) {
		out.print("old");
		if (e.getLabel() != null) {
			out.print("[");
			out.print(e.getLabel());
			out.print("]");
		}
		out.print("(");
		writeExpression(e.getOperand());
		out.print(")");
	}

	private void writeAccess(Expr location, Expr permission) {
		out.print("acc(");
		writeExpression(location);
		if (!(permission instanceof Expr.FullPerm)) {
			out.print(", ");
			writeExpression(permission);
		}
		out.print(")");
	}

	private void tab(int indent) {
		for (int i = 0; i != indent; ++i) {
			out.print("  ");
		}
	}

	/**
	 * Render a given item as a string. Trailing whitespace is removed, such
	 * that a single statement yields a single line.
	 *
	 * @param item
	 * @return
	 */
	public static String toString(SilFile.Item item) {
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		SilFilePrinter printer = new SilFilePrinter(bout);
		printer.write(item);
		printer.flush();
		return new String(bout.toByteArray(), StandardCharsets.UTF_8).trim();
	}
}
