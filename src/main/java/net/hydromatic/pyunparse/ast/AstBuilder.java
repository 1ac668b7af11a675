/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.pyunparse.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  private static <E> @Nullable ImmutableList<E> copyOrNull(
      @Nullable Iterable<? extends E> elements) {
    return elements == null ? null : ImmutableList.copyOf(elements);
  }

  // Literals

  public Ast.Literal ellipsis(Pos pos) {
    return new Ast.Literal(pos, Op.ELLIPSIS_LITERAL, null);
  }

  public Ast.Literal none(Pos pos) {
    return new Ast.Literal(pos, Op.NONE_LITERAL, null);
  }

  public Ast.Literal boolLiteral(Pos pos, boolean b) {
    return new Ast.Literal(pos, Op.BOOL_LITERAL, b);
  }

  public Ast.Literal intLiteral(Pos pos, BigInteger value) {
    return new Ast.Literal(pos, Op.INT_LITERAL, value);
  }

  public Ast.Literal intLiteral(Pos pos, long value) {
    return intLiteral(pos, BigInteger.valueOf(value));
  }

  public Ast.Literal floatLiteral(Pos pos, double value) {
    return new Ast.Literal(pos, Op.FLOAT_LITERAL, value);
  }

  public Ast.ComplexLiteral complexLiteral(Pos pos, double real,
      double imaginary) {
    return new Ast.ComplexLiteral(pos, real, imaginary);
  }

  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  public Ast.BytesLiteral bytesLiteral(Pos pos, byte[] value) {
    return new Ast.BytesLiteral(pos, value);
  }

  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  // Displays and comprehensions

  public Ast.Item item(Pos pos, Ast.Exp value) {
    return new Ast.Item(pos, value, false);
  }

  public Ast.Item starItem(Pos pos, Ast.Exp value) {
    return new Ast.Item(pos, value, true);
  }

  /** Creates a list of plain items, one per expression. */
  public List<Ast.Item> items(Iterable<? extends Ast.Exp> values) {
    final ImmutableList.Builder<Ast.Item> b = ImmutableList.builder();
    for (Ast.Exp value : values) {
      b.add(item(value.pos, value));
    }
    return b.build();
  }

  public Ast.DictItem dictItem(Pos pos, Ast.Exp key, Ast.Exp value) {
    return new Ast.DictItem(pos, key, value);
  }

  /** Creates a "**d" item in a dict display. */
  public Ast.DictItem starStarItem(Pos pos, Ast.Exp value) {
    return new Ast.DictItem(pos, null, value);
  }

  public Ast.Dict dict(Pos pos, Iterable<? extends Ast.DictItem> items) {
    return new Ast.Dict(pos, ImmutableList.copyOf(items));
  }

  public Ast.SetExp set(Pos pos, Iterable<? extends Ast.Item> items) {
    return new Ast.SetExp(pos, ImmutableList.copyOf(items));
  }

  public Ast.ListExp list(Pos pos, Iterable<? extends Ast.Item> items) {
    return new Ast.ListExp(pos, ImmutableList.copyOf(items));
  }

  public Ast.Tuple tuple(Pos pos, Iterable<? extends Ast.Item> items) {
    return new Ast.Tuple(pos, ImmutableList.copyOf(items));
  }

  public Ast.Tuple tuple(Pos pos, Ast.Item... items) {
    return new Ast.Tuple(pos, ImmutableList.copyOf(items));
  }

  public Ast.Comprehension dictComp(Pos pos, Ast.DictItem seed,
      Iterable<? extends Ast.CompChunk> chunks) {
    return new Ast.Comprehension(pos, Op.DICT_COMP, seed,
        ImmutableList.copyOf(chunks));
  }

  public Ast.Comprehension setComp(Pos pos, Ast.Item seed,
      Iterable<? extends Ast.CompChunk> chunks) {
    return new Ast.Comprehension(pos, Op.SET_COMP, seed,
        ImmutableList.copyOf(chunks));
  }

  public Ast.Comprehension listComp(Pos pos, Ast.Item seed,
      Iterable<? extends Ast.CompChunk> chunks) {
    return new Ast.Comprehension(pos, Op.LIST_COMP, seed,
        ImmutableList.copyOf(chunks));
  }

  public Ast.Comprehension generator(Pos pos, Ast.Item seed,
      Iterable<? extends Ast.CompChunk> chunks) {
    return new Ast.Comprehension(pos, Op.GENERATOR, seed,
        ImmutableList.copyOf(chunks));
  }

  public Ast.CompFor compFor(Pos pos, boolean async,
      Iterable<? extends Ast.Exp> targets, Ast.Exp iterable) {
    return new Ast.CompFor(pos, async, ImmutableList.copyOf(targets),
        iterable);
  }

  public Ast.CompIf compIf(Pos pos, Ast.Exp condition) {
    return new Ast.CompIf(pos, condition);
  }

  // Trailers

  public Ast.Call call(Pos pos, Ast.Exp fn, Ast.Arglist args) {
    return new Ast.Call(pos, fn, args);
  }

  /** Creates a call with positional arguments only, e.g. "f(a, b)". */
  public Ast.Call call(Pos pos, Ast.Exp fn, Ast.Exp... args) {
    final ImmutableList.Builder<Ast.Arg> b = ImmutableList.builder();
    for (Ast.Exp arg : args) {
      b.add(arg(arg.pos, arg));
    }
    return call(pos, fn, new Ast.Arglist(pos, b.build(), ImmutableList.of()));
  }

  public Ast.Arglist arglist(Pos pos, Iterable<? extends Ast.Arg> positional,
      Iterable<? extends Ast.KeywordArg> keywords) {
    return new Ast.Arglist(pos, ImmutableList.copyOf(positional),
        ImmutableList.copyOf(keywords));
  }

  /** Creates an argument list from arguments in source order, each an
   * {@link Ast.Arg} or {@link Ast.KeywordArg}.
   *
   * @throws IllegalArgumentException if the arguments are not in a valid
   * order; see {@link #validateArgs(Iterable)}
   */
  public Ast.Arglist arglist(Pos pos, Iterable<? extends AstNode> args) {
    final ArgumentError error = validateArgs(args);
    if (error != null) {
      throw new IllegalArgumentException(error.message + " (code "
          + error.code + ")");
    }
    final ImmutableList.Builder<Ast.Arg> positional = ImmutableList.builder();
    final ImmutableList.Builder<Ast.KeywordArg> keywords =
        ImmutableList.builder();
    for (AstNode arg : args) {
      if (arg instanceof Ast.Arg) {
        positional.add((Ast.Arg) arg);
      } else {
        keywords.add((Ast.KeywordArg) arg);
      }
    }
    return new Ast.Arglist(pos, positional.build(), keywords.build());
  }

  /** Checks the order of arguments in source order. Returns the first
   * error, or null if the arguments are valid.
   *
   * <p>Once a keyword argument or "**kwargs" has been seen, no positional
   * argument or "*args" may follow. */
  public @Nullable ArgumentError validateArgs(
      Iterable<? extends AstNode> args) {
    boolean seenKeyword = false;
    for (AstNode arg : args) {
      switch (arg.op) {
        case ARG:
          if (seenKeyword) {
            return ((Ast.Arg) arg).star
                ? ArgumentError.STARARGS_AFTER_KEYWORD
                : ArgumentError.POSITIONAL_AFTER_KEYWORD;
          }
          break;
        case KEYWORD_ARG:
          seenKeyword = true;
          break;
        default:
          throw new IllegalArgumentException("not an argument: " + arg.op);
      }
    }
    return null;
  }

  public Ast.Arg arg(Pos pos, Ast.Exp value) {
    return new Ast.Arg(pos, value, false);
  }

  /** Creates a "*args" argument. */
  public Ast.Arg starArg(Pos pos, Ast.Exp value) {
    return new Ast.Arg(pos, value, true);
  }

  public Ast.KeywordArg keywordArg(Pos pos, String name, Ast.Exp value) {
    return new Ast.KeywordArg(pos, name, value);
  }

  /** Creates a "**kwargs" argument. */
  public Ast.KeywordArg starStarArg(Pos pos, Ast.Exp value) {
    return new Ast.KeywordArg(pos, null, value);
  }

  public Ast.Subscript subscript(Pos pos, Ast.Exp base,
      Iterable<? extends Ast.SliceItem> slices) {
    return new Ast.Subscript(pos, base, ImmutableList.copyOf(slices));
  }

  public Ast.Subscript subscript(Pos pos, Ast.Exp base,
      Ast.SliceItem... slices) {
    return new Ast.Subscript(pos, base, ImmutableList.copyOf(slices));
  }

  public Ast.Index index(Pos pos, Ast.Exp value) {
    return new Ast.Index(pos, value);
  }

  /** Creates a slice with one colon, e.g. "1:2". */
  public Ast.Slice slice(Pos pos, Ast.@Nullable Exp lower,
      Ast.@Nullable Exp upper) {
    return new Ast.Slice(pos, lower, upper, null, false);
  }

  /** Creates a slice with two colons, e.g. "1:2:3" or "::". */
  public Ast.Slice slice(Pos pos, Ast.@Nullable Exp lower,
      Ast.@Nullable Exp upper, Ast.@Nullable Exp step) {
    return new Ast.Slice(pos, lower, upper, step, true);
  }

  public Ast.Attribute attribute(Pos pos, Ast.Exp base, String name) {
    return new Ast.Attribute(pos, base, name);
  }

  // Operators

  public Ast.PrefixCall prefixCall(Pos pos, Op op, Ast.Exp a) {
    return new Ast.PrefixCall(pos, op, a);
  }

  public Ast.InfixCall infixCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(pos, op, a0, a1);
  }

  public Ast.InfixCall plus(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(a0.pos, Op.PLUS, a0, a1);
  }

  public Ast.InfixCall times(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(a0.pos, Op.TIMES, a0, a1);
  }

  public Ast.InfixCall and(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(a0.pos, Op.AND, a0, a1);
  }

  public Ast.InfixCall or(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(a0.pos, Op.OR, a0, a1);
  }

  public Ast.Ternary ternary(Pos pos, Ast.Exp condition, Ast.Exp ifTrue,
      Ast.Exp ifFalse) {
    return new Ast.Ternary(pos, condition, ifTrue, ifFalse);
  }

  public Ast.Yield yieldExp(Pos pos, Iterable<? extends Ast.Exp> values) {
    return new Ast.Yield(pos, ImmutableList.copyOf(values));
  }

  public Ast.YieldFrom yieldFrom(Pos pos, Ast.Exp value) {
    return new Ast.YieldFrom(pos, value);
  }

  public Ast.Star star(Pos pos, Ast.Exp value) {
    return new Ast.Star(pos, value);
  }

  public Ast.Lambda lambda(Pos pos, Ast.Parameters parameters,
      Ast.Exp body) {
    return new Ast.Lambda(pos, parameters, body);
  }

  // Parameters

  public Ast.Param param(Pos pos, String name) {
    return new Ast.Param(pos, name, null, null);
  }

  public Ast.Param param(Pos pos, String name, Ast.@Nullable Exp annotation,
      Ast.@Nullable Exp defaultValue) {
    return new Ast.Param(pos, name, annotation, defaultValue);
  }

  /** Creates a parameter list that has only positional parameters. */
  public Ast.Parameters parameters(Pos pos, boolean typed,
      Iterable<? extends Ast.Param> positional) {
    return parameters(pos, typed, positional, Ast.StarKind.NONE, null,
        ImmutableList.of(), null);
  }

  public Ast.Parameters parameters(Pos pos, boolean typed,
      Iterable<? extends Ast.Param> positional, Ast.StarKind starKind,
      Ast.@Nullable Param starArgs, Iterable<? extends Ast.Param> keyword,
      Ast.@Nullable Param starKwargs) {
    return new Ast.Parameters(pos, typed, ImmutableList.copyOf(positional),
        starKind, starArgs, ImmutableList.copyOf(keyword), starKwargs);
  }

  public Ast.Decorator decorator(Pos pos, List<String> name,
      Ast.@Nullable Arglist args) {
    return new Ast.Decorator(pos, ImmutableList.copyOf(name), args);
  }

  // Simple statements

  public Ast.KeywordStmt pass(Pos pos) {
    return new Ast.KeywordStmt(pos, Op.PASS);
  }

  public Ast.KeywordStmt breakStmt(Pos pos) {
    return new Ast.KeywordStmt(pos, Op.BREAK);
  }

  public Ast.KeywordStmt continueStmt(Pos pos) {
    return new Ast.KeywordStmt(pos, Op.CONTINUE);
  }

  public Ast.Del del(Pos pos, Iterable<String> names) {
    return new Ast.Del(pos, ImmutableList.copyOf(names));
  }

  public Ast.Return returnStmt(Pos pos, Iterable<? extends Ast.Exp> values) {
    return new Ast.Return(pos, ImmutableList.copyOf(values));
  }

  public Ast.Raise raise(Pos pos, Ast.@Nullable Exp exception,
      Ast.@Nullable Exp cause) {
    return new Ast.Raise(pos, exception, cause);
  }

  public Ast.Declare global(Pos pos, Iterable<String> names) {
    return new Ast.Declare(pos, Op.GLOBAL, ImmutableList.copyOf(names));
  }

  public Ast.Declare nonlocal(Pos pos, Iterable<String> names) {
    return new Ast.Declare(pos, Op.NONLOCAL, ImmutableList.copyOf(names));
  }

  public Ast.Assert assertStmt(Pos pos, Ast.Exp test,
      Ast.@Nullable Exp message) {
    return new Ast.Assert(pos, test, message);
  }

  public Ast.Alias alias(Pos pos, List<String> path,
      @Nullable String asName) {
    return new Ast.Alias(pos, ImmutableList.copyOf(path), asName);
  }

  public Ast.Import importStmt(Pos pos, Iterable<? extends Ast.Alias> names) {
    return new Ast.Import(pos, ImmutableList.copyOf(names));
  }

  /** Creates a "from ... import" statement. If {@code names} is empty,
   * imports all names ("*"). */
  public Ast.ImportFrom importFrom(Pos pos, int leadingDots,
      List<String> path, Iterable<? extends Ast.Alias> names) {
    return new Ast.ImportFrom(pos, leadingDots, ImmutableList.copyOf(path),
        ImmutableList.copyOf(names));
  }

  public Ast.ExpStmt expStmt(Pos pos, Ast.Exp... values) {
    return new Ast.ExpStmt(pos, ImmutableList.copyOf(values));
  }

  public Ast.ExpStmt expStmt(Pos pos, Iterable<? extends Ast.Exp> values) {
    return new Ast.ExpStmt(pos, ImmutableList.copyOf(values));
  }

  /** Creates a chained assignment, "targets = values0 = values1 ...". */
  public Ast.Assign assign(Pos pos, Iterable<? extends Ast.Exp> targets,
      Iterable<? extends Iterable<? extends Ast.Exp>> values) {
    final ImmutableList.Builder<List<Ast.Exp>> b = ImmutableList.builder();
    for (Iterable<? extends Ast.Exp> value : values) {
      b.add(ImmutableList.copyOf(value));
    }
    return new Ast.Assign(pos, ImmutableList.copyOf(targets), b.build());
  }

  /** Creates a simple assignment, "target = value". */
  public Ast.Assign assign(Pos pos, Ast.Exp target, Ast.Exp value) {
    return new Ast.Assign(pos, ImmutableList.of(target),
        ImmutableList.of(ImmutableList.of(value)));
  }

  public Ast.AnnAssign annAssign(Pos pos, Iterable<? extends Ast.Exp> targets,
      Ast.Exp annotation, Iterable<? extends Ast.Exp> values) {
    return new Ast.AnnAssign(pos, ImmutableList.copyOf(targets), annotation,
        ImmutableList.copyOf(values));
  }

  /** Creates an augmented assignment. The operator may be an augmented
   * assignment operator, such as {@link Op#PLUS_ASSIGN}, or the binary
   * operator it is derived from, such as {@link Op#PLUS}. */
  public Ast.AugAssign augAssign(Pos pos, Iterable<? extends Ast.Exp> targets,
      Op op, Iterable<? extends Ast.Exp> values) {
    final Op assignOp = op.kind == Op.Kind.AUGMENTED ? op : op.toAugmented();
    return new Ast.AugAssign(pos, assignOp, ImmutableList.copyOf(targets),
        ImmutableList.copyOf(values));
  }

  /** Creates an augmented assignment from the spelling of its operator,
   * e.g. "+=" or "+". */
  public Ast.AugAssign augAssign(Pos pos, Iterable<? extends Ast.Exp> targets,
      String opName, Iterable<? extends Ast.Exp> values) {
    final Op op = Op.BY_OP_NAME.get(opName);
    checkArgument(op != null
            && (op.kind == Op.Kind.AUGMENTED || op.kind == Op.Kind.INFIX),
        "unknown operator %s", opName);
    return augAssign(pos, targets, op, values);
  }

  // Compound statements

  public Ast.IfBranch ifBranch(Pos pos, Ast.Exp condition,
      Iterable<? extends Ast.Stmt> block) {
    return new Ast.IfBranch(pos, condition, ImmutableList.copyOf(block));
  }

  public Ast.If ifStmt(Pos pos, Iterable<? extends Ast.IfBranch> branches,
      @Nullable Iterable<? extends Ast.Stmt> orElse) {
    return new Ast.If(pos, ImmutableList.copyOf(branches), copyOrNull(orElse));
  }

  public Ast.For forStmt(Pos pos, boolean async,
      Iterable<? extends Ast.Exp> targets,
      Iterable<? extends Ast.Exp> iterables,
      Iterable<? extends Ast.Stmt> body,
      @Nullable Iterable<? extends Ast.Stmt> orElse) {
    return new Ast.For(pos, async, ImmutableList.copyOf(targets),
        ImmutableList.copyOf(iterables), ImmutableList.copyOf(body),
        copyOrNull(orElse));
  }

  public Ast.While whileStmt(Pos pos, Ast.Exp condition,
      Iterable<? extends Ast.Stmt> body,
      @Nullable Iterable<? extends Ast.Stmt> orElse) {
    return new Ast.While(pos, condition, ImmutableList.copyOf(body),
        copyOrNull(orElse));
  }

  public Ast.WithItem withItem(Pos pos, Ast.Exp context,
      Ast.@Nullable Exp binding) {
    return new Ast.WithItem(pos, context, binding);
  }

  public Ast.With with(Pos pos, Iterable<? extends Ast.WithItem> items,
      Iterable<? extends Ast.Stmt> body) {
    return new Ast.With(pos, ImmutableList.copyOf(items),
        ImmutableList.copyOf(body));
  }

  public Ast.FunDef funDef(Pos pos,
      Iterable<? extends Ast.Decorator> decorators,
      boolean async, String name, Ast.Parameters parameters,
      Ast.@Nullable Exp returnType, Iterable<? extends Ast.Stmt> body) {
    checkArgument(parameters.typed,
        "parameters of function %s must be typed", name);
    return new Ast.FunDef(pos, ImmutableList.copyOf(decorators), async, name,
        parameters, returnType, ImmutableList.copyOf(body));
  }

  public Ast.ClassDef classDef(Pos pos,
      Iterable<? extends Ast.Decorator> decorators, String name,
      Ast.@Nullable Arglist bases, Iterable<? extends Ast.Stmt> body) {
    return new Ast.ClassDef(pos, ImmutableList.copyOf(decorators), name,
        bases, ImmutableList.copyOf(body));
  }

  public Ast.ExceptClause exceptClause(Pos pos, Ast.Exp guard,
      @Nullable String name, Iterable<? extends Ast.Stmt> block) {
    return new Ast.ExceptClause(pos, guard, name,
        ImmutableList.copyOf(block));
  }

  /** Creates a "try" statement. An empty {@code bareExcept},
   * {@code orElse} or {@code finalBody} means that there is no such
   * clause. */
  public Ast.Try tryStmt(Pos pos, Iterable<? extends Ast.Stmt> body,
      Iterable<? extends Ast.ExceptClause> excepts,
      Iterable<? extends Ast.Stmt> bareExcept,
      Iterable<? extends Ast.Stmt> orElse,
      Iterable<? extends Ast.Stmt> finalBody) {
    return new Ast.Try(pos, ImmutableList.copyOf(body),
        ImmutableList.copyOf(excepts), ImmutableList.copyOf(bareExcept),
        ImmutableList.copyOf(orElse), ImmutableList.copyOf(finalBody));
  }
}

// End AstBuilder.java
