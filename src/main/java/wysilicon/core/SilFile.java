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
package wysilicon.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A program in the intermediate verification language accepted by the symbolic
 * executor. A program is a flat list of field, predicate and method
 * declarations. Method bodies are kept in structured form here and lowered
 * into a control-flow graph (see {@link Cfg}) before execution.
 *
 * @author David J. Pearce
 *
 */
public class SilFile {
	/**
	 * The list of top-level declarations within this file.
	 */
	private final List<Decl> declarations;

	public SilFile() {
		this.declarations = new ArrayList<>();
	}

	public SilFile(Collection<? extends Decl> declarations) {
		this.declarations = new ArrayList<>(declarations);
	}

	public List<Decl> getDeclarations() {
		return declarations;
	}

	public SilFile add(Decl decl) {
		declarations.add(decl);
		return this;
	}

	public List<Decl.Method> getMethods() {
		ArrayList<Decl.Method> methods = new ArrayList<>();
		for (Decl d : declarations) {
			if (d instanceof Decl.Method) {
				methods.add((Decl.Method) d);
			}
		}
		return methods;
	}

	/**
	 * Look up a method by name. Names are assumed to have been resolved by an
	 * earlier well-formedness pass, hence an unknown name is a programmer error
	 * rather than a verification failure.
	 *
	 * @param name
	 * @return
	 */
	public Decl.Method findMethod(String name) {
		return find(Decl.Method.class, name);
	}

	public Decl.Predicate findPredicate(String name) {
		return find(Decl.Predicate.class, name);
	}

	public Decl.Field findField(String name) {
		return find(Decl.Field.class, name);
	}

	private <T extends Decl> T find(Class<T> kind, String name) {
		for (Decl d : declarations) {
			if (kind.isInstance(d) && d.getName().equals(name)) {
				return kind.cast(d);
			}
		}
		throw new IllegalArgumentException("unknown " + kind.getSimpleName().toLowerCase() + " \"" + name + "\"");
	}

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 * @return
		 */
		public Attribute[] getAttributes();
	}

	public static class AbstractItem implements Item {
		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public <T> T getAttribute(Class<T> kind) {
			for(int i=0;i!=attributes.length;++i) {
				T ith = attributes[i].as(kind);
				if(ith != null) {
					return ith;
				}
			}
			return null;
		}

		@Override
		public Attribute[] getAttributes() {
			return attributes;
		}

		public boolean isFalse() {
			return (this instanceof Expr.Boolean) && !((Expr.Boolean) this).getValue();
		}

		public boolean isTrue() {
			return (this instanceof Expr.Boolean) && ((Expr.Boolean) this).getValue();
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public interface Decl extends Item {

		public String getName();

		/**
		 * A field declaration. Every object carries every declared field, hence
		 * object creation produces one field chunk per declaration.
		 */
		public static class Field extends AbstractItem implements Decl {
			private final String name;
			private final Type type;

			public Field(String name, Type type, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.type = type;
			}

			@Override
			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}
		}

		/**
		 * <p>
		 * A predicate abstracts over the resources described by its body. For
		 * example, the following predicate describes a single cell:
		 * </p>
		 *
		 * <pre>
		 * predicate cell(x : Ref) {
		 *   acc(x.val)
		 * }
		 * </pre>
		 *
		 * <p>
		 * Folding a predicate exchanges the resources of its body for a predicate
		 * chunk, whilst unfolding performs the reverse exchange. A predicate without
		 * a body is abstract and can be neither folded nor unfolded.
		 * </p>
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Predicate extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final Expr body;

			public Predicate(String name, List<Parameter> parameters, Expr body, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.parameters = new ArrayList<>(parameters);
				this.body = body;
			}

			@Override
			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			public Expr getBody() {
				return body;
			}
		}

		public static class Method extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final List<Parameter> returns;
			private final List<Expr> requires;
			private final List<Expr> ensures;
			private final Stmt body;

			public Method(String name, List<Parameter> parameters, List<Parameter> returns, List<Expr> requires,
					List<Expr> ensures, Stmt body, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.parameters = new ArrayList<>(parameters);
				this.returns = new ArrayList<>(returns);
				this.requires = new ArrayList<>(requires);
				this.ensures = new ArrayList<>(ensures);
				this.body = body;
			}

			@Override
			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			public List<Parameter> getReturns() {
				return returns;
			}

			public List<Expr> getRequires() {
				return requires;
			}

			public List<Expr> getEnsures() {
				return ensures;
			}

			/**
			 * Get the body of this method, or <code>null</code> if the method is
			 * abstract.
			 *
			 * @return
			 */
			public Stmt getBody() {
				return body;
			}
		}

		public static class Parameter extends AbstractItem implements Decl {
			private final String name;
			private final Type type;

			public Parameter(String name, Type type, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.type = type;
			}

			@Override
			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}

			public Expr.VariableAccess toAccess() {
				return new Expr.VariableAccess(name, type, getAttributes());
			}
		}
	}

	// =========================================================================
	// Statements
	// =========================================================================

	public interface Stmt extends Item {

		public static class Sequence extends AbstractItem implements Stmt {
			private final List<Stmt> stmts;

			private Sequence(Collection<Stmt> stmts, Attribute[] attributes) {
				super(attributes);
				this.stmts = new ArrayList<>(stmts);
			}

			public int size() {
				return stmts.size();
			}

			public Stmt get(int i) {
				return stmts.get(i);
			}

			public List<Stmt> getAll() {
				return stmts;
			}
		}

		/**
		 * Assignment to a local variable. When the variable has type
		 * {@link Type#Wand} the right-hand side must be a magic wand, and the
		 * variable is bound to the (already packaged) wand rather than to a value.
		 */
		public static class LocalAssign extends AbstractItem implements Stmt {
			private final Expr.VariableAccess lhs;
			private final Expr rhs;

			private LocalAssign(Expr.VariableAccess lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr.VariableAccess getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class FieldWrite extends AbstractItem implements Stmt {
			private final Expr.FieldAccess lhs;
			private final Expr rhs;

			private FieldWrite(Expr.FieldAccess lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr.FieldAccess getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class New extends AbstractItem implements Stmt {
			private final Expr.VariableAccess lhs;
			private final List<Decl.Field> fields;

			private New(Expr.VariableAccess lhs, Collection<Decl.Field> fields, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.fields = new ArrayList<>(fields);
			}

			public Expr.VariableAccess getLeftHandSide() {
				return lhs;
			}

			public List<Decl.Field> getFields() {
				return fields;
			}
		}

		/**
		 * Introduces fresh abstract read permissions for a set of variables.
		 */
		public static class Fresh extends AbstractItem implements Stmt {
			private final List<Expr.VariableAccess> variables;

			private Fresh(Collection<Expr.VariableAccess> variables, Attribute[] attributes) {
				super(attributes);
				this.variables = new ArrayList<>(variables);
			}

			public List<Expr.VariableAccess> getVariables() {
				return variables;
			}
		}

		public static class Inhale extends AbstractItem implements Stmt {
			private final Expr condition;

			private Inhale(Expr condition, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
			}

			public Expr getCondition() {
				return condition;
			}
		}

		public static class Exhale extends AbstractItem implements Stmt {
			private final Expr condition;

			private Exhale(Expr condition, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
			}

			public Expr getCondition() {
				return condition;
			}
		}

		public static class Assert extends AbstractItem implements Stmt {
			private final Expr condition;

			private Assert(Expr condition, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
			}

			public Expr getCondition() {
				return condition;
			}
		}

		public static class MethodCall extends AbstractItem implements Stmt {
			private final String name;
			private final List<Expr> arguments;
			private final List<Expr.VariableAccess> targets;

			private MethodCall(String name, Collection<Expr> arguments, Collection<Expr.VariableAccess> targets,
					Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.arguments = new ArrayList<>(arguments);
				this.targets = new ArrayList<>(targets);
			}

			public String getName() {
				return name;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			public List<Expr.VariableAccess> getTargets() {
				return targets;
			}
		}

		public static class Fold extends AbstractItem implements Stmt {
			private final Expr.PredicateAccessPredicate predicate;

			private Fold(Expr.PredicateAccessPredicate predicate, Attribute[] attributes) {
				super(attributes);
				this.predicate = predicate;
			}

			public Expr.PredicateAccessPredicate getPredicate() {
				return predicate;
			}
		}

		public static class Unfold extends AbstractItem implements Stmt {
			private final Expr.PredicateAccessPredicate predicate;

			private Unfold(Expr.PredicateAccessPredicate predicate, Attribute[] attributes) {
				super(attributes);
				this.predicate = predicate;
			}

			public Expr.PredicateAccessPredicate getPredicate() {
				return predicate;
			}
		}

		public static class Package extends AbstractItem implements Stmt {
			private final Expr.MagicWand wand;

			private Package(Expr.MagicWand wand, Attribute[] attributes) {
				super(attributes);
				this.wand = wand;
			}

			public Expr.MagicWand getWand() {
				return wand;
			}
		}

		/**
		 * Applies a magic wand, given either inline or through a variable of wand
		 * type.
		 */
		public static class Apply extends AbstractItem implements Stmt {
			private final Expr wand;

			private Apply(Expr wand, Attribute[] attributes) {
				super(attributes);
				this.wand = wand;
			}

			public Expr getWand() {
				return wand;
			}
		}

		public static class Constraining extends AbstractItem implements Stmt {
			private final List<Expr.VariableAccess> variables;
			private final Stmt body;

			private Constraining(Collection<Expr.VariableAccess> variables, Stmt body, Attribute[] attributes) {
				super(attributes);
				this.variables = new ArrayList<>(variables);
				this.body = body;
			}

			public List<Expr.VariableAccess> getVariables() {
				return variables;
			}

			public Stmt getBody() {
				return body;
			}
		}

		public static class IfElse extends AbstractItem implements Stmt {
			private final Expr condition;
			private final Stmt trueBranch;
			private final Stmt falseBranch;

			private IfElse(Expr condition, Stmt trueBranch, Stmt falseBranch, Attribute... attributes) {
				super(attributes);
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Expr getCondition() {
				return condition;
			}

			public Stmt getTrueBranch() {
				return trueBranch;
			}

			public Stmt getFalseBranch() {
				return falseBranch;
			}
		}

		public static class While extends AbstractItem implements Stmt {
			private final Expr condition;
			private final List<Expr> invariant;
			private final Stmt body;

			private While(Expr condition, List<Expr> invariant, Stmt body, Attribute... attributes) {
				super(attributes);
				this.condition = condition;
				this.invariant = new ArrayList<>(invariant);
				this.body = body;
			}

			public Expr getCondition() {
				return condition;
			}

			public List<Expr> getInvariant() {
				return invariant;
			}

			public Stmt getBody() {
				return body;
			}
		}

		public static class Label extends AbstractItem implements Stmt {
			private final String label;

			private Label(String label, Attribute[] attributes) {
				super(attributes);
				this.label = label;
			}

			public String getLabel() {
				return label;
			}
		}

		public static class Goto extends AbstractItem implements Stmt {
			private final String label;

			private Goto(String label, Attribute[] attributes) {
				super(attributes);
				this.label = label;
			}

			public String getLabel() {
				return label;
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr extends Item {

		public interface UnaryOperator {
			Expr getOperand();
		}

		public interface BinaryOperator {
			Expr getLeftHandSide();
			Expr getRightHandSide();
		}

		public interface NaryOperator {
			List<? extends Expr> getOperands();
		}

		/**
		 * Marks expressions which denote resources (rather than pure values) and,
		 * hence, can only appear in assertions.
		 */
		public interface Resource extends Expr {
		}

		public static abstract class AbstractBinary extends AbstractItem implements Expr, BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			protected AbstractBinary(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Equals extends AbstractBinary {
			private Equals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class NotEquals extends AbstractBinary {
			private NotEquals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class LessThan extends AbstractBinary {
			private LessThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class LessThanOrEqual extends AbstractBinary {
			private LessThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class GreaterThan extends AbstractBinary {
			private GreaterThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class GreaterThanOrEqual extends AbstractBinary {
			private GreaterThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Implies extends AbstractBinary {
			private Implies(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Addition extends AbstractBinary {
			private Addition(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Subtraction extends AbstractBinary {
			private Subtraction(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Multiplication extends AbstractBinary {
			private Multiplication(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		/**
		 * Integer division. Evaluation fails when the divisor may be zero.
		 */
		public static class Division extends AbstractBinary {
			private Division(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Boolean extends AbstractItem implements Expr {
			private final boolean value;

			private Boolean(boolean v, Attribute[] attributes) {
				super(attributes);
				this.value = v;
			}

			public boolean getValue() {
				return value;
			}
		}

		public static class Integer extends AbstractItem implements Expr {
			private final BigInteger value;

			private Integer(BigInteger v, Attribute[] attributes) {
				super(attributes);
				this.value = v;
			}

			public BigInteger getValue() {
				return value;
			}

			@Override
			public String toString() {
				return "INT(" + value + ")";
			}
		}

		public static class Null extends AbstractItem implements Expr {
			private Null(Attribute[] attributes) {
				super(attributes);
			}
		}

		public static class Negation extends AbstractItem implements Expr, UnaryOperator {
			private final Expr operand;

			private Negation(Expr operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			@Override
			public Expr getOperand() {
				return operand;
			}
		}

		public static class LogicalNot extends AbstractItem implements Expr, UnaryOperator {
			private final Expr operand;

			private LogicalNot(Expr operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			@Override
			public Expr getOperand() {
				return operand;
			}

			@Override
			public String toString() {
				return "NOT(" + operand + ")";
			}
		}

		public static class LogicalAnd extends AbstractItem implements Expr, NaryOperator {
			private final List<Expr> operands;

			private LogicalAnd(List<Expr> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = new ArrayList<>(operands);
			}

			@Override
			public List<Expr> getOperands() {
				return operands;
			}
		}

		public static class LogicalOr extends AbstractItem implements Expr, NaryOperator {
			private final List<Expr> operands;

			private LogicalOr(List<Expr> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = new ArrayList<>(operands);
			}

			@Override
			public List<Expr> getOperands() {
				return operands;
			}
		}

		/**
		 * An expression evaluated in an earlier heap. Without a label, the heap
		 * is the old heap of the enclosing method (or loop); with the label
		 * {@link #LHS} it is the heap in which the left-hand side of a magic wand
		 * was consumed.
		 */
		public static class Old extends AbstractItem implements Expr, UnaryOperator {
			public static final String LHS = "lhs";

			private final Expr operand;
			private final String label;

			private Old(Expr operand, String label, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
				this.label = label;
			}

			@Override
			public Expr getOperand() {
				return operand;
			}

			public String getLabel() {
				return label;
			}

			@Override
			public String toString() {
				return "OLD(" + operand + ")";
			}
		}

		public static class VariableAccess extends AbstractItem implements Expr {
			private final String variable;
			private final Type type;

			private VariableAccess(String var, Type type, Attribute[] attributes) {
				super(attributes);
				if(var == null || type == null) {
					throw new IllegalArgumentException();
				}
				this.variable = var;
				this.type = type;
			}

			public String getVariable() {
				return variable;
			}

			public Type getType() {
				return type;
			}

			@Override
			public String toString() {
				return "VAR(" + variable + ")";
			}
		}

		public static class FieldAccess extends AbstractItem implements Expr {
			private final Expr receiver;
			private final Decl.Field field;

			private FieldAccess(Expr receiver, Decl.Field field, Attribute[] attributes) {
				super(attributes);
				this.receiver = receiver;
				this.field = field;
			}

			public Expr getReceiver() {
				return receiver;
			}

			public Decl.Field getField() {
				return field;
			}

			@Override
			public String toString() {
				return "FIELD(" + receiver + ", " + field.getName() + ")";
			}
		}

		public static class PredicateAccess extends AbstractItem implements Expr {
			private final String name;
			private final List<Expr> arguments;

			private PredicateAccess(String name, Collection<Expr> arguments, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.arguments = new ArrayList<>(arguments);
			}

			public String getName() {
				return name;
			}

			public List<Expr> getArguments() {
				return arguments;
			}
		}

		public static class FullPerm extends AbstractItem implements Expr {
			private FullPerm(Attribute[] attributes) {
				super(attributes);
			}
		}

		public static class NoPerm extends AbstractItem implements Expr {
			private NoPerm(Attribute[] attributes) {
				super(attributes);
			}
		}

		public static class FractionalPerm extends AbstractBinary {
			private FractionalPerm(Expr numerator, Expr denominator, Attribute[] attributes) {
				super(numerator, denominator, attributes);
			}
		}

		/**
		 * The permission currently held to a given field location.
		 */
		public static class CurrentPerm extends AbstractItem implements Expr {
			private final FieldAccess location;

			private CurrentPerm(FieldAccess location, Attribute[] attributes) {
				super(attributes);
				this.location = location;
			}

			public FieldAccess getLocation() {
				return location;
			}
		}

		public static class FieldAccessPredicate extends AbstractItem implements Resource {
			private final FieldAccess location;
			private final Expr permission;

			private FieldAccessPredicate(FieldAccess location, Expr permission, Attribute[] attributes) {
				super(attributes);
				this.location = location;
				this.permission = permission;
			}

			public FieldAccess getLocation() {
				return location;
			}

			public Expr getPermission() {
				return permission;
			}
		}

		public static class PredicateAccessPredicate extends AbstractItem implements Resource {
			private final PredicateAccess location;
			private final Expr permission;

			private PredicateAccessPredicate(PredicateAccess location, Expr permission, Attribute[] attributes) {
				super(attributes);
				this.location = location;
				this.permission = permission;
			}

			public PredicateAccess getLocation() {
				return location;
			}

			public Expr getPermission() {
				return permission;
			}
		}

		/**
		 * <p>
		 * A magic wand <code>A --* B</code>. Holding such a wand means that, given
		 * the resources described by <code>A</code>, they can be exchanged for those
		 * described by <code>B</code>. For example:
		 * </p>
		 *
		 * <pre>
		 * package acc(x.f) --* acc(x.f) && acc(y.f)
		 * </pre>
		 *
		 * <p>
		 * Here, the permission to <code>y.f</code> is taken from the current heap
		 * and stored within the wand until it is applied.
		 * </p>
		 */
		public static class MagicWand extends AbstractItem implements Resource, BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private MagicWand(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}
	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type extends Item {
		public static final Type Bool = new Bool();
		public static final Type Int = new Int();
		public static final Type Ref = new Ref();
		public static final Type Perm = new Perm();
		public static final Type Wand = new Wand();

		public static class Bool extends AbstractItem implements Type {
			public Bool(Attribute... attributes) {
				super(attributes);
			}
		}

		public static class Int extends AbstractItem implements Type {
			public Int(Attribute... attributes) {
				super(attributes);
			}
		}

		public static class Ref extends AbstractItem implements Type {
			public Ref(Attribute... attributes) {
				super(attributes);
			}
		}

		public static class Perm extends AbstractItem implements Type {
			public Perm(Attribute... attributes) {
				super(attributes);
			}
		}

		public static class Wand extends AbstractItem implements Type {
			public Wand(Attribute... attributes) {
				super(attributes);
			}
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Get the contents of this attribute as a given kind.  If that doesn't match, then return <code>null</code>.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T as(Class<T> kind);
	}

	/**
	 * A position within the original source file. Positions are attached to
	 * items as attributes and reported alongside verification errors.
	 */
	public static final class Position {
		private final int line;
		private final int column;

		public Position(int line, int column) {
			this.line = line;
			this.column = column;
		}

		public int getLine() {
			return line;
		}

		public int getColumn() {
			return column;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Position) {
				Position p = (Position) o;
				return line == p.line && column == p.column;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return line * 31 + column;
		}

		@Override
		public String toString() {
			return line + "." + column;
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static Attribute ATTRIBUTE(Object o) {
		return new Attribute() {
			@Override
			public <T> T as(Class<T> kind) {
				if(kind.isInstance(o)) {
					return kind.cast(o);
				} else {
					return null;
				}
			}

			@Override
			public String toString() {
				return "ATTR(" + o + ")";
			}
		};
	}

	public static Attribute POSITION(int line, int column) {
		return ATTRIBUTE(new Position(line, column));
	}

	// Declarations

	public static Decl.Field FIELD(String name, Type type, Attribute... attributes) {
		return new Decl.Field(name, type, attributes);
	}

	public static Decl.Parameter PARAMETER(String name, Type type, Attribute... attributes) {
		return new Decl.Parameter(name, type, attributes);
	}

	public static Decl.Predicate PREDICATE(String name, List<Decl.Parameter> parameters, Expr body,
			Attribute... attributes) {
		return new Decl.Predicate(name, parameters, body, attributes);
	}

	public static Decl.Method METHOD(String name, List<Decl.Parameter> parameters, List<Decl.Parameter> returns,
			List<Expr> requires, List<Expr> ensures, Stmt body, Attribute... attributes) {
		return new Decl.Method(name, parameters, returns, requires, ensures, body, attributes);
	}

	public static Decl.Method METHOD(String name, List<Decl.Parameter> parameters, Stmt body,
			Attribute... attributes) {
		return new Decl.Method(name, parameters, Collections.emptyList(), Collections.emptyList(),
				Collections.emptyList(), body, attributes);
	}

	// Statements

	public static Stmt.Sequence SEQUENCE(List<Stmt> stmts, Attribute... attributes) {
		return new Stmt.Sequence(stmts, attributes);
	}

	public static Stmt.Sequence SEQUENCE(Stmt... stmts) {
		return new Stmt.Sequence(Arrays.asList(stmts), new Attribute[0]);
	}

	public static Stmt.LocalAssign ASSIGN(Expr.VariableAccess lhs, Expr rhs, Attribute... attributes) {
		return new Stmt.LocalAssign(lhs, rhs, attributes);
	}

	public static Stmt.FieldWrite ASSIGN(Expr.FieldAccess lhs, Expr rhs, Attribute... attributes) {
		return new Stmt.FieldWrite(lhs, rhs, attributes);
	}

	public static Stmt.New NEW(Expr.VariableAccess lhs, List<Decl.Field> fields, Attribute... attributes) {
		return new Stmt.New(lhs, fields, attributes);
	}

	public static Stmt.Fresh FRESH(List<Expr.VariableAccess> variables, Attribute... attributes) {
		return new Stmt.Fresh(variables, attributes);
	}

	public static Stmt.Inhale INHALE(Expr condition, Attribute... attributes) {
		return new Stmt.Inhale(condition, attributes);
	}

	public static Stmt.Exhale EXHALE(Expr condition, Attribute... attributes) {
		return new Stmt.Exhale(condition, attributes);
	}

	public static Stmt.Assert ASSERT(Expr condition, Attribute... attributes) {
		return new Stmt.Assert(condition, attributes);
	}

	public static Stmt.MethodCall CALL(String name, List<Expr> arguments, List<Expr.VariableAccess> targets,
			Attribute... attributes) {
		return new Stmt.MethodCall(name, arguments, targets, attributes);
	}

	public static Stmt.MethodCall CALL(String name, List<Expr> arguments, Attribute... attributes) {
		return new Stmt.MethodCall(name, arguments, Collections.emptyList(), attributes);
	}

	public static Stmt.Fold FOLD(Expr.PredicateAccessPredicate predicate, Attribute... attributes) {
		return new Stmt.Fold(predicate, attributes);
	}

	public static Stmt.Unfold UNFOLD(Expr.PredicateAccessPredicate predicate, Attribute... attributes) {
		return new Stmt.Unfold(predicate, attributes);
	}

	public static Stmt.Package PACKAGE(Expr.MagicWand wand, Attribute... attributes) {
		return new Stmt.Package(wand, attributes);
	}

	public static Stmt.Apply APPLY(Expr wand, Attribute... attributes) {
		return new Stmt.Apply(wand, attributes);
	}

	public static Stmt.Constraining CONSTRAINING(List<Expr.VariableAccess> variables, Stmt body,
			Attribute... attributes) {
		return new Stmt.Constraining(variables, body, attributes);
	}

	public static Stmt.IfElse IFELSE(Expr condition, Stmt trueBranch, Stmt falseBranch, Attribute... attributes) {
		return new Stmt.IfElse(condition, trueBranch, falseBranch, attributes);
	}

	public static Stmt.While WHILE(Expr condition, List<Expr> invariant, Stmt body, Attribute... attributes) {
		return new Stmt.While(condition, invariant, body, attributes);
	}

	public static Stmt.Label LABEL(String label, Attribute... attributes) {
		return new Stmt.Label(label, attributes);
	}

	public static Stmt.Goto GOTO(String label, Attribute... attributes) {
		return new Stmt.Goto(label, attributes);
	}

	// Expressions

	public static Expr.Boolean CONST(boolean b, Attribute... attributes) {
		return new Expr.Boolean(b, attributes);
	}

	public static Expr.Integer CONST(long i, Attribute... attributes) {
		return new Expr.Integer(BigInteger.valueOf(i), attributes);
	}

	public static Expr.Integer CONST(BigInteger i, Attribute... attributes) {
		return new Expr.Integer(i, attributes);
	}

	public static Expr.Null NULL(Attribute... attributes) {
		return new Expr.Null(attributes);
	}

	public static Expr.VariableAccess VAR(String name, Type type, Attribute... attributes) {
		return new Expr.VariableAccess(name, type, attributes);
	}

	public static Expr.FieldAccess FIELDACCESS(Expr receiver, Decl.Field field, Attribute... attributes) {
		return new Expr.FieldAccess(receiver, field, attributes);
	}

	public static Expr.Equals EQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Equals(lhs, rhs, attributes);
	}

	public static Expr.NotEquals NEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.NotEquals(lhs, rhs, attributes);
	}

	public static Expr.LessThan LT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThan(lhs, rhs, attributes);
	}

	public static Expr.LessThanOrEqual LTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThanOrEqual(lhs, rhs, attributes);
	}

	public static Expr.GreaterThan GT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThan(lhs, rhs, attributes);
	}

	public static Expr.GreaterThanOrEqual GTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThanOrEqual(lhs, rhs, attributes);
	}

	public static Expr.Implies IMPLIES(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Implies(lhs, rhs, attributes);
	}

	public static Expr.Addition ADD(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Addition(lhs, rhs, attributes);
	}

	public static Expr.Subtraction SUB(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Subtraction(lhs, rhs, attributes);
	}

	public static Expr.Multiplication MUL(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Multiplication(lhs, rhs, attributes);
	}

	public static Expr.Division DIV(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Division(lhs, rhs, attributes);
	}

	public static Expr.Negation NEG(Expr operand, Attribute... attributes) {
		return new Expr.Negation(operand, attributes);
	}

	public static Expr.LogicalNot NOT(Expr operand, Attribute... attributes) {
		return new Expr.LogicalNot(operand, attributes);
	}

	public static Expr AND(List<Expr> operands, Attribute... attributes) {
		ArrayList<Expr> noperands = new ArrayList<>();
		for(int i=0;i!=operands.size();++i) {
			Expr ith = operands.get(i);
			if (ith instanceof AbstractItem && ((AbstractItem) ith).isFalse()) {
				return new Expr.Boolean(false, attributes);
			} else if (!(ith instanceof AbstractItem) || !((AbstractItem) ith).isTrue()) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
			case 0:
				return new Expr.Boolean(true, attributes);
			case 1:
				return noperands.get(0);
			default:
				return new Expr.LogicalAnd(noperands, attributes);
		}
	}

	public static Expr AND(Expr lhs, Expr rhs, Attribute... attributes) {
		return AND(Arrays.asList(lhs, rhs), attributes);
	}

	public static Expr.LogicalOr OR(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LogicalOr(Arrays.asList(lhs, rhs), attributes);
	}

	public static Expr.Old OLD(Expr operand, Attribute... attributes) {
		return new Expr.Old(operand, null, attributes);
	}

	public static Expr.Old OLD(String label, Expr operand, Attribute... attributes) {
		return new Expr.Old(operand, label, attributes);
	}

	public static Expr.FullPerm WRITE(Attribute... attributes) {
		return new Expr.FullPerm(attributes);
	}

	public static Expr.NoPerm NONE(Attribute... attributes) {
		return new Expr.NoPerm(attributes);
	}

	public static Expr.FractionalPerm FRACTION(Expr numerator, Expr denominator, Attribute... attributes) {
		return new Expr.FractionalPerm(numerator, denominator, attributes);
	}

	public static Expr.CurrentPerm PERM(Expr.FieldAccess location, Attribute... attributes) {
		return new Expr.CurrentPerm(location, attributes);
	}

	public static Expr.FieldAccessPredicate ACC(Expr.FieldAccess location, Attribute... attributes) {
		return new Expr.FieldAccessPredicate(location, WRITE(), attributes);
	}

	public static Expr.FieldAccessPredicate ACC(Expr.FieldAccess location, Expr permission, Attribute... attributes) {
		return new Expr.FieldAccessPredicate(location, permission, attributes);
	}

	public static Expr.PredicateAccess PREDICATEACCESS(String name, List<Expr> arguments, Attribute... attributes) {
		return new Expr.PredicateAccess(name, arguments, attributes);
	}

	public static Expr.PredicateAccessPredicate ACC(Expr.PredicateAccess location, Attribute... attributes) {
		return new Expr.PredicateAccessPredicate(location, WRITE(), attributes);
	}

	public static Expr.PredicateAccessPredicate ACC(Expr.PredicateAccess location, Expr permission,
			Attribute... attributes) {
		return new Expr.PredicateAccessPredicate(location, permission, attributes);
	}

	public static Expr.MagicWand WAND(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.MagicWand(lhs, rhs, attributes);
	}
}
