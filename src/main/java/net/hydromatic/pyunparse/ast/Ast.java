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
import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Returns whether a double has a negative sign, including -0.0. */
  static boolean isNegative(double d) {
    return Math.copySign(1d, d) < 0;
  }

  /** Throws if a block that must contain statements is empty. */
  static <E extends Stmt> ImmutableList<E> checkBlock(ImmutableList<E> block,
      String clause) {
    checkArgument(!block.isEmpty(), "%s block must not be empty", clause);
    return block;
  }

  //~ Expressions -------------------------------------------------------------

  /** Base class of expression ASTs. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    /** Returns whether this expression can be an operand of an operator
     * without being enclosed in parentheses.
     *
     * <p>Literals, names, displays and comprehensions are atoms; numeric
     * literals with a negative sign are not. */
    public boolean isAtom() {
      return op.atom;
    }
  }

  /** Parse tree node of an identifier (a reference to a name). */
  public static class Id extends Exp {
    public final String name;

    /** Creates an Id. */
    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Id && this.name.equals(((Id) o).name);
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.id(name);
    }
  }

  /** Parse tree node of a literal (constant).
   *
   * <p>The value is a {@link Boolean}, {@link BigInteger}, {@link Double}
   * or {@link String}; it is null for "None" and "...". */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final @Nullable Comparable value;

    /** Creates a Literal. */
    Literal(Pos pos, Op op, @Nullable Comparable value) {
      super(pos, op);
      this.value = value;
      switch (op) {
        case ELLIPSIS_LITERAL:
        case NONE_LITERAL:
          checkArgument(value == null);
          break;
        case BOOL_LITERAL:
          checkArgument(value instanceof Boolean);
          break;
        case INT_LITERAL:
          checkArgument(value instanceof BigInteger);
          break;
        case FLOAT_LITERAL:
          checkArgument(value instanceof Double);
          break;
        case STRING_LITERAL:
          checkArgument(value instanceof String);
          break;
        default:
          throw new AssertionError("not a literal: " + op);
      }
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && this.op == ((Literal) o).op
              && Objects.equals(this.value, ((Literal) o).value);
    }

    @Override
    public boolean isAtom() {
      switch (op) {
        case INT_LITERAL:
          return ((BigInteger) requireNonNull(value)).signum() >= 0;
        case FLOAT_LITERAL:
          return !isNegative((Double) requireNonNull(value));
        default:
          return true;
      }
    }

    @Override
    AstWriter write(AstWriter w) {
      switch (op) {
        case ELLIPSIS_LITERAL:
          return w.append("...");
        case NONE_LITERAL:
          return w.append("None");
        case BOOL_LITERAL:
          return w.append((Boolean) requireNonNull(value) ? "True" : "False");
        case INT_LITERAL:
          return w.append(requireNonNull(value).toString());
        case FLOAT_LITERAL:
          final double d = (Double) requireNonNull(value);
          if (!Double.isFinite(d)) {
            throw new UnsupportedConstructException(this,
                "float " + d + " has no literal form");
          }
          // Double.toString always has a '.' or exponent, e.g. "1.0E10"
          return w.append(Double.toString(d));
        case STRING_LITERAL:
          return w.appendString((String) requireNonNull(value));
        default:
          throw new AssertionError(op);
      }
    }
  }

  /** Parse tree node of a complex literal, e.g. "2j".
   *
   * <p>Source text can only express imaginary literals; a value with a
   * non-zero real part is written as a parenthesized sum, e.g.
   * "(1.0+2.0j)". */
  public static class ComplexLiteral extends Exp {
    public final double real;
    public final double imaginary;

    ComplexLiteral(Pos pos, double real, double imaginary) {
      super(pos, Op.COMPLEX_LITERAL);
      this.real = real;
      this.imaginary = imaginary;
    }

    @Override
    public int hashCode() {
      return Objects.hash(real, imaginary);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ComplexLiteral
              && Double.compare(real, ((ComplexLiteral) o).real) == 0
              && Double.compare(imaginary, ((ComplexLiteral) o).imaginary)
                  == 0;
    }

    private boolean isImaginary() {
      return real == 0d && !isNegative(real);
    }

    @Override
    public boolean isAtom() {
      return !isImaginary() || !isNegative(imaginary);
    }

    @Override
    AstWriter write(AstWriter w) {
      if (!Double.isFinite(real) || !Double.isFinite(imaginary)) {
        throw new UnsupportedConstructException(this,
            "complex " + real + "+" + imaginary + "j has no literal form");
      }
      if (isImaginary()) {
        return w.append(Double.toString(imaginary)).append("j");
      }
      return w.append("(")
          .append(Double.toString(real))
          .append(isNegative(imaginary) ? "-" : "+")
          .append(Double.toString(Math.abs(imaginary)))
          .append("j)");
    }
  }

  /** Parse tree node of a bytes literal, e.g. {@code b"abc"}. */
  public static class BytesLiteral extends Exp {
    private final byte[] value;

    BytesLiteral(Pos pos, byte[] value) {
      super(pos, Op.BYTES_LITERAL);
      this.value = value.clone();
    }

    /** Returns a copy of the value. */
    public byte[] value() {
      return value.clone();
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof BytesLiteral
              && Arrays.equals(value, ((BytesLiteral) o).value);
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.appendBytes(value);
    }
  }

  /** Item of a set, list or tuple display, or the seed of a
   * comprehension; either a value or a star-splat, e.g. "*a". */
  public static class Item extends AstNode {
    public final Exp value;
    public final boolean star;

    Item(Pos pos, Exp value, boolean star) {
      super(pos, Op.ITEM);
      this.value = requireNonNull(value);
      this.star = star;
    }

    @Override
    AstWriter write(AstWriter w) {
      return star ? w.append("*").operand(value) : w.exp(value);
    }
  }

  /** Item of a dict display; either a key-value pair, e.g. "k:v", or a
   * double-star-splat, e.g. "**d", if {@link #key} is null. */
  public static class DictItem extends AstNode {
    public final @Nullable Exp key;
    public final Exp value;

    DictItem(Pos pos, @Nullable Exp key, Exp value) {
      super(pos, Op.DICT_ITEM);
      this.key = key;
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter write(AstWriter w) {
      if (key == null) {
        return w.append("**").operand(value);
      }
      return w.exp(key).append(":").exp(value);
    }
  }

  /** Dict display, e.g. "{a:1, **b}". */
  public static class Dict extends Exp {
    public final List<DictItem> items;

    Dict(Pos pos, ImmutableList<DictItem> items) {
      super(pos, Op.DICT);
      this.items = requireNonNull(items);
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.appendAll(items, "{", ", ", "}");
    }
  }

  /** Set display, e.g. "{a, *b}".
   *
   * <p>An empty set is written "{*()}", because "{}" is an empty dict. */
  public static class SetExp extends Exp {
    public final List<Item> items;

    SetExp(Pos pos, ImmutableList<Item> items) {
      super(pos, Op.SET);
      this.items = requireNonNull(items);
    }

    @Override
    AstWriter write(AstWriter w) {
      if (items.isEmpty()) {
        return w.append("{*()}");
      }
      return w.appendAll(items, "{", ", ", "}");
    }
  }

  /** List display, e.g. "[a, *b]". */
  public static class ListExp extends Exp {
    public final List<Item> items;

    ListExp(Pos pos, ImmutableList<Item> items) {
      super(pos, Op.LIST);
      this.items = requireNonNull(items);
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.appendAll(items, "[", ", ", "]");
    }
  }

  /** Tuple display, e.g. "(a, b)"; a tuple with one item has a trailing
   * comma, "(a,)". */
  public static class Tuple extends Exp {
    public final List<Item> items;

    Tuple(Pos pos, ImmutableList<Item> items) {
      super(pos, Op.TUPLE);
      this.items = requireNonNull(items);
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.appendAll(items, "(", ", ", items.size() == 1 ? ",)" : ")");
    }
  }

  /** Comprehension: a dict, set or list comprehension, or a generator
   * expression.
   *
   * <p>The seed is a {@link DictItem} for a dict comprehension and an
   * {@link Item} otherwise. Chunks are written in the order given; "for"
   * and "if" chunks may interleave. */
  public static class Comprehension extends Exp {
    public final AstNode seed;
    public final List<CompChunk> chunks;

    Comprehension(Pos pos, Op op, AstNode seed,
        ImmutableList<CompChunk> chunks) {
      super(pos, op);
      this.seed = requireNonNull(seed);
      this.chunks = requireNonNull(chunks);
      checkArgument(op == Op.DICT_COMP
              ? seed instanceof DictItem
              : seed instanceof Item,
          "seed %s is not valid for %s", seed.op, op);
      checkArgument(!chunks.isEmpty()
              && chunks.get(0) instanceof CompFor,
          "comprehension must start with a 'for' chunk");
    }

    @Override
    AstWriter write(AstWriter w) {
      final String open;
      final String close;
      switch (op) {
        case DICT_COMP:
        case SET_COMP:
          open = "{";
          close = "}";
          break;
        case LIST_COMP:
          open = "[";
          close = "]";
          break;
        case GENERATOR:
          open = "(";
          close = ")";
          break;
        default:
          throw new AssertionError(op);
      }
      return w.append(open).append(seed)
          .appendAll(chunks, " ", " ", close);
    }
  }

  /** A "for" or "if" clause in a comprehension. */
  public abstract static class CompChunk extends AstNode {
    CompChunk(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** A "for" clause in a comprehension, e.g. "async for k, v in d". */
  public static class CompFor extends CompChunk {
    public final boolean async;
    public final List<Exp> targets;
    public final Exp iterable;

    CompFor(Pos pos, boolean async, ImmutableList<Exp> targets,
        Exp iterable) {
      super(pos, Op.COMP_FOR);
      this.async = async;
      this.targets = requireNonNull(targets);
      this.iterable = requireNonNull(iterable);
      checkArgument(!targets.isEmpty());
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.append(async ? "async for " : "for ")
          .targets(targets)
          .append(" in ")
          .orTest(iterable);
    }
  }

  /** An "if" clause in a comprehension, e.g. "if x > 0". */
  public static class CompIf extends CompChunk {
    public final Exp condition;

    CompIf(Pos pos, Exp condition) {
      super(pos, Op.COMP_IF);
      this.condition = requireNonNull(condition);
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.append("if ").orTest(condition);
    }
  }

  /** Call of a function, e.g. "f(x, *a, k=1, **kw)". */
  public static class Call extends Exp {
    public final Exp fn;
    public final Arglist args;

    Call(Pos pos, Exp fn, Arglist args) {
      super(pos, Op.CALL);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.trailerBase(fn).append("(").append(args).append(")");
    }
  }

  /** Subscript, e.g. "a[i]" or "a[1:2, ::3]". */
  public static class Subscript extends Exp {
    public final Exp base;
    public final List<SliceItem> slices;

    Subscript(Pos pos, Exp base, ImmutableList<SliceItem> slices) {
      super(pos, Op.SUBSCRIPT);
      this.base = requireNonNull(base);
      this.slices = requireNonNull(slices);
      checkArgument(!slices.isEmpty());
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.trailerBase(base).appendAll(slices, "[", ", ", "]");
    }
  }

  /** One comma-separated part of a subscript. */
  public abstract static class SliceItem extends AstNode {
    SliceItem(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Simple index in a subscript, e.g. "i" in "a[i]". */
  public static class Index extends SliceItem {
    public final Exp value;

    Index(Pos pos, Exp value) {
      super(pos, Op.INDEX);
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.exp(value);
    }
  }

  /** Slice in a subscript, e.g. "1:2" or "::-1".
   *
   * <p>If {@link #stepped}, the slice has two colons (and possibly a step);
   * otherwise it has one colon and {@link #step} is null. */
  public static class Slice extends SliceItem {
    public final @Nullable Exp lower;
    public final @Nullable Exp upper;
    public final @Nullable Exp step;
    public final boolean stepped;

    Slice(Pos pos, @Nullable Exp lower, @Nullable Exp upper,
        @Nullable Exp step, boolean stepped) {
      super(pos, Op.SLICE);
      this.lower = lower;
      this.upper = upper;
      this.step = step;
      this.stepped = stepped;
      checkArgument(stepped || step == null,
          "two-part slice cannot have a step");
    }

    @Override
    AstWriter write(AstWriter w) {
      optional(w, lower).append(":");
      optional(w, upper);
      if (stepped) {
        optional(w.append(":"), step);
      }
      return w;
    }

    private static AstWriter optional(AstWriter w, @Nullable Exp e) {
      return e == null ? w : w.orTest(e);
    }
  }

  /** Attribute access, e.g. "a.b". */
  public static class Attribute extends Exp {
    public final Exp base;
    public final String name;

    Attribute(Pos pos, Exp base, String name) {
      super(pos, Op.ATTRIBUTE);
      this.base = requireNonNull(base);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter write(AstWriter w) {
      if (base.op == Op.INT_LITERAL) {
        // "1.real" would be read as the float "1." followed by "real"
        w.append("(").append(base).append(")");
      } else {
        w.trailerBase(base);
      }
      return w.append(".").id(name);
    }
  }

  /** Call to a prefix operator, e.g. "-x" or "not (a and b)". */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Pos pos, Op op, Exp a) {
      super(pos, op);
      this.a = requireNonNull(a);
      checkArgument(Op.PREFIX_OPS.contains(op), "not a prefix op: %s", op);
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.append(op.padded).operand(a);
    }
  }

  /** Call to an infix operator, e.g. "a+(b*c)". */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(Op.INFIX_OPS.contains(op), "not an infix op: %s", op);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a0, a1);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof InfixCall
              && op == ((InfixCall) o).op
              && a0.equals(((InfixCall) o).a0)
              && a1.equals(((InfixCall) o).a1);
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.operand(a0).append(op.padded).operand(a1);
    }
  }

  /** Conditional expression, "ifTrue if condition else ifFalse".
   *
   * <p>All three operands are always enclosed in parentheses. */
  public static class Ternary extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    Ternary(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.TERNARY);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.append("(").append(ifTrue)
          .append(") if (").append(condition)
          .append(") else (").append(ifFalse)
          .append(")");
    }
  }

  /** Yield expression, e.g. "yield a, b" or "yield". */
  public static class Yield extends Exp {
    public final List<Exp> values;

    Yield(Pos pos, ImmutableList<Exp> values) {
      super(pos, Op.YIELD);
      this.values = requireNonNull(values);
    }

    @Override
    AstWriter write(AstWriter w) {
      w.append("yield");
      return values.isEmpty() ? w : w.append(" ").expList(values);
    }
  }

  /** Yield-from expression, e.g. "yield from g". */
  public static class YieldFrom extends Exp {
    public final Exp value;

    YieldFrom(Pos pos, Exp value) {
      super(pos, Op.YIELD_FROM);
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.append("yield from ").exp(value);
    }
  }

  /** Star expression, e.g. "*rest" in "first, *rest = xs". */
  public static class Star extends Exp {
    public final Exp value;

    Star(Pos pos, Exp value) {
      super(pos, Op.STAR);
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.append("*").operand(value);
    }
  }

  /** Lambda expression, e.g. "lambda x, y=1: x+y". */
  public static class Lambda extends Exp {
    public final Parameters parameters;
    public final Exp body;

    Lambda(Pos pos, Parameters parameters, Exp body) {
      super(pos, Op.LAMBDA);
      this.parameters = requireNonNull(parameters);
      this.body = requireNonNull(body);
      checkArgument(!parameters.typed,
          "lambda parameters cannot have annotations");
    }

    @Override
    AstWriter write(AstWriter w) {
      w.append("lambda");
      if (!parameters.isEmpty()) {
        w.append(" ").append(parameters);
      }
      return w.append(": ").exp(body);
    }
  }

  //~ Arguments and parameters ------------------------------------------------

  /** Argument list of a call. Positional arguments come first, then keyword
   * arguments.
   *
   * <p>The list is assumed to be valid; see {@link ArgumentError} for the
   * rules that the parser checks. */
  public static class Arglist extends AstNode {
    public final List<Arg> positional;
    public final List<KeywordArg> keywords;

    Arglist(Pos pos, ImmutableList<Arg> positional,
        ImmutableList<KeywordArg> keywords) {
      super(pos, Op.ARGLIST);
      this.positional = requireNonNull(positional);
      this.keywords = requireNonNull(keywords);
    }

    public boolean isEmpty() {
      return positional.isEmpty() && keywords.isEmpty();
    }

    @Override
    AstWriter write(AstWriter w) {
      w.commaList(positional);
      if (!positional.isEmpty() && !keywords.isEmpty()) {
        w.append(", ");
      }
      return w.commaList(keywords);
    }
  }

  /** Positional argument, e.g. "x" or "*args". */
  public static class Arg extends AstNode {
    public final Exp value;
    public final boolean star;

    Arg(Pos pos, Exp value, boolean star) {
      super(pos, Op.ARG);
      this.value = requireNonNull(value);
      this.star = star;
    }

    @Override
    AstWriter write(AstWriter w) {
      return star ? w.append("*").operand(value) : w.exp(value);
    }
  }

  /** Keyword argument, e.g. "k=1", or "**kwargs" if {@link #name} is
   * null. */
  public static class KeywordArg extends AstNode {
    public final @Nullable String name;
    public final Exp value;

    KeywordArg(Pos pos, @Nullable String name, Exp value) {
      super(pos, Op.KEYWORD_ARG);
      this.name = name;
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter write(AstWriter w) {
      if (name == null) {
        return w.append("**").operand(value);
      }
      return w.id(name).append("=").exp(value);
    }
  }

  /** Parameter of a function or lambda, e.g. "x", "x:int" or "x:int=0". */
  public static class Param extends AstNode {
    public final String name;
    public final @Nullable Exp annotation;
    public final @Nullable Exp defaultValue;

    Param(Pos pos, String name, @Nullable Exp annotation,
        @Nullable Exp defaultValue) {
      super(pos, Op.PARAM);
      this.name = requireNonNull(name);
      this.annotation = annotation;
      this.defaultValue = defaultValue;
    }

    @Override
    AstWriter write(AstWriter w) {
      w.id(name);
      if (annotation != null) {
        w.append(":").exp(annotation);
      }
      if (defaultValue != null) {
        w.append("=").exp(defaultValue);
      }
      return w;
    }
  }

  /** What comes between the positional and keyword-only parameters. */
  public enum StarKind {
    /** No star; there are no keyword-only parameters. */
    NONE,
    /** A bare "*". */
    BARE,
    /** A named star parameter, e.g. "*args". */
    NAMED
  }

  /** Parameter list of a function definition or lambda.
   *
   * <p>A typed list (for a function definition) may have annotations; an
   * untyped list (for a lambda) may not. */
  public static class Parameters extends AstNode {
    public final boolean typed;
    public final List<Param> positional;
    public final StarKind starKind;
    public final @Nullable Param starArgs;
    public final List<Param> keyword;
    public final @Nullable Param starKwargs;

    Parameters(Pos pos, boolean typed, ImmutableList<Param> positional,
        StarKind starKind, @Nullable Param starArgs,
        ImmutableList<Param> keyword, @Nullable Param starKwargs) {
      super(pos, Op.PARAMETERS);
      this.typed = typed;
      this.positional = requireNonNull(positional);
      this.starKind = requireNonNull(starKind);
      this.starArgs = starArgs;
      this.keyword = requireNonNull(keyword);
      this.starKwargs = starKwargs;
      checkArgument((starKind == StarKind.NAMED) == (starArgs != null),
          "star parameter must be present if and only if star kind is NAMED");
      checkArgument(keyword.isEmpty() || starKind != StarKind.NONE,
          "keyword-only parameters require a star");
      checkArgument(starArgs == null || starArgs.defaultValue == null,
          "star parameter cannot have a default");
      checkArgument(starKwargs == null || starKwargs.defaultValue == null,
          "double-star parameter cannot have a default");
      if (!typed) {
        for (Param param : params()) {
          checkArgument(param.annotation == null,
              "untyped parameter %s has an annotation", param.name);
        }
      }
    }

    /** Returns all named parameters, in order. */
    public List<Param> params() {
      final ImmutableList.Builder<Param> b = ImmutableList.builder();
      b.addAll(positional);
      if (starArgs != null) {
        b.add(starArgs);
      }
      b.addAll(keyword);
      if (starKwargs != null) {
        b.add(starKwargs);
      }
      return b.build();
    }

    public boolean isEmpty() {
      return positional.isEmpty()
          && starKind == StarKind.NONE
          && starKwargs == null;
    }

    @Override
    AstWriter write(AstWriter w) {
      // Groups are separated by ", "; empty groups are skipped.
      int groupCount = 0;
      if (!positional.isEmpty()) {
        w.commaList(positional);
        ++groupCount;
      }
      switch (starKind) {
        case BARE:
          separate(w, groupCount++).append("*");
          break;
        case NAMED:
          separate(w, groupCount++).append("*")
              .append(requireNonNull(starArgs));
          break;
        default:
          break;
      }
      if (!keyword.isEmpty()) {
        separate(w, groupCount++).commaList(keyword);
      }
      if (starKwargs != null) {
        separate(w, groupCount).append("**").append(starKwargs);
      }
      return w;
    }

    private static AstWriter separate(AstWriter w, int groupCount) {
      return groupCount > 0 ? w.append(", ") : w;
    }
  }

  /** Decorator of a function or class definition, e.g. "@a.b(c)".
   *
   * <p>Writes a whole line, including indentation. */
  public static class Decorator extends AstNode {
    public final List<String> name;
    public final @Nullable Arglist args;

    Decorator(Pos pos, ImmutableList<String> name, @Nullable Arglist args) {
      super(pos, Op.DECORATOR);
      this.name = requireNonNull(name);
      this.args = args;
      checkArgument(!name.isEmpty());
    }

    @Override
    AstWriter write(AstWriter w) {
      w.indent().append("@").dotted(name);
      if (args != null) {
        w.append("(").append(args).append(")");
      }
      return w.newline();
    }
  }

  //~ Statements --------------------------------------------------------------

  /** Base class of statement ASTs. */
  public abstract static class Stmt extends AstNode {
    Stmt(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Statement that occupies a single line. */
  public abstract static class SimpleStmt extends Stmt {
    SimpleStmt(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    final AstWriter write(AstWriter w) {
      return writeLine(w.indent()).newline();
    }

    /** Writes the body of the line, without indentation or line break. */
    abstract AstWriter writeLine(AstWriter w);
  }

  /** Statement that is a keyword: "pass", "break" or "continue". */
  public static class KeywordStmt extends SimpleStmt {
    KeywordStmt(Pos pos, Op op) {
      super(pos, op);
      checkArgument(op.kind == Op.Kind.KEYWORD, "not a keyword: %s", op);
    }

    @Override
    AstWriter writeLine(AstWriter w) {
      return w.append(op.padded);
    }
  }

  /** "del" statement, e.g. "del a, b". */
  public static class Del extends SimpleStmt {
    public final List<String> names;

    Del(Pos pos, ImmutableList<String> names) {
      super(pos, Op.DEL);
      this.names = requireNonNull(names);
      checkArgument(!names.isEmpty());
    }

    @Override
    AstWriter writeLine(AstWriter w) {
      return w.append("del ").ids(names);
    }
  }

  /** "return" statement, e.g. "return 1, 2" or "return". */
  public static class Return extends SimpleStmt {
    public final List<Exp> values;

    Return(Pos pos, ImmutableList<Exp> values) {
      super(pos, Op.RETURN);
      this.values = requireNonNull(values);
    }

    @Override
    AstWriter writeLine(AstWriter w) {
      w.append("return");
      return values.isEmpty() ? w : w.append(" ").expList(values);
    }
  }

  /** "raise" statement: "raise", "raise e" or "raise e from c". */
  public static class Raise extends SimpleStmt {
    public final @Nullable Exp exception;
    public final @Nullable Exp cause;

    Raise(Pos pos, @Nullable Exp exception, @Nullable Exp cause) {
      super(pos, Op.RAISE);
      this.exception = exception;
      this.cause = cause;
      checkArgument(exception != null || cause == null,
          "cause requires exception");
    }

    @Override
    AstWriter writeLine(AstWriter w) {
      w.append("raise");
      if (exception != null) {
        w.append(" ").exp(exception);
        if (cause != null) {
          w.append(" from ").exp(cause);
        }
      }
      return w;
    }
  }

  /** "global" or "nonlocal" statement, e.g. "global a, b". */
  public static class Declare extends SimpleStmt {
    public final List<String> names;

    Declare(Pos pos, Op op, ImmutableList<String> names) {
      super(pos, op);
      this.names = requireNonNull(names);
      checkArgument(op.kind == Op.Kind.DECLARE, "not a declaration: %s", op);
      checkArgument(!names.isEmpty());
    }

    @Override
    AstWriter writeLine(AstWriter w) {
      return w.append(op.padded).ids(names);
    }
  }

  /** "assert" statement, e.g. "assert x, 'message'". */
  public static class Assert extends SimpleStmt {
    public final Exp test;
    public final @Nullable Exp message;

    Assert(Pos pos, Exp test, @Nullable Exp message) {
      super(pos, Op.ASSERT);
      this.test = requireNonNull(test);
      this.message = message;
    }

    @Override
    AstWriter writeLine(AstWriter w) {
      w.append("assert ").exp(test);
      return message == null ? w : w.append(", ").exp(message);
    }
  }

  /** Name in an import statement, with an optional alias; e.g. "os.path as
   * p" in "import os.path as p", or "x" in "from m import x". */
  public static class Alias extends AstNode {
    public final List<String> path;
    public final @Nullable String asName;

    Alias(Pos pos, ImmutableList<String> path, @Nullable String asName) {
      super(pos, Op.ALIAS);
      this.path = requireNonNull(path);
      this.asName = asName;
      checkArgument(!path.isEmpty());
    }

    @Override
    AstWriter write(AstWriter w) {
      w.dotted(path);
      return asName == null ? w : w.append(" as ").id(asName);
    }
  }

  /** "import" statement, e.g. "import os.path as p, sys". */
  public static class Import extends SimpleStmt {
    public final List<Alias> names;

    Import(Pos pos, ImmutableList<Alias> names) {
      super(pos, Op.IMPORT);
      this.names = requireNonNull(names);
      checkArgument(!names.isEmpty());
    }

    @Override
    AstWriter writeLine(AstWriter w) {
      return w.append("import ").commaList(names);
    }
  }

  /** "from ... import" statement, e.g. "from ..pkg import x as y, z".
   *
   * <p>If {@link #names} is empty, imports all names: "from m import *". */
  public static class ImportFrom extends SimpleStmt {
    public final int leadingDots;
    public final List<String> path;
    public final List<Alias> names;

    ImportFrom(Pos pos, int leadingDots, ImmutableList<String> path,
        ImmutableList<Alias> names) {
      super(pos, Op.IMPORT_FROM);
      this.leadingDots = leadingDots;
      this.path = requireNonNull(path);
      this.names = requireNonNull(names);
      checkArgument(leadingDots >= 0);
      checkArgument(leadingDots > 0 || !path.isEmpty(),
          "module path is required if import is not relative");
      for (Alias name : names) {
        checkArgument(name.path.size() == 1,
            "imported name must not be dotted: %s", name.path);
      }
    }

    @Override
    AstWriter writeLine(AstWriter w) {
      w.append("from ")
          .append(Strings.repeat(".", leadingDots))
          .dotted(path)
          .append(" import ");
      return names.isEmpty() ? w.append("*") : w.commaList(names);
    }
  }

  /** Statement that is a sequence of expressions, e.g. "f(x)". */
  public static class ExpStmt extends SimpleStmt {
    public final List<Exp> values;

    ExpStmt(Pos pos, ImmutableList<Exp> values) {
      super(pos, Op.EXP_STMT);
      this.values = requireNonNull(values);
      checkArgument(!values.isEmpty());
    }

    @Override
    AstWriter writeLine(AstWriter w) {
      return w.stmtList(values);
    }
  }

  /** Assignment, e.g. "a, b = c = f()".
   *
   * <p>For "lhs = rhs1 = rhs2", {@link #targets} is "lhs" and {@link #values}
   * is ["rhs1", "rhs2"]. */
  public static class Assign extends SimpleStmt {
    public final List<Exp> targets;
    public final List<List<Exp>> values;

    Assign(Pos pos, ImmutableList<Exp> targets,
        ImmutableList<List<Exp>> values) {
      super(pos, Op.ASSIGN);
      this.targets = requireNonNull(targets);
      this.values = requireNonNull(values);
      checkArgument(!targets.isEmpty());
      checkArgument(!values.isEmpty());
      for (List<Exp> value : values) {
        checkArgument(!value.isEmpty());
      }
    }

    @Override
    AstWriter writeLine(AstWriter w) {
      w.commaList(targets);
      for (List<Exp> value : values) {
        w.append(" = ").stmtList(value);
      }
      return w;
    }
  }

  /** Annotated assignment, e.g. "x: int = 0", or "x: int" if
   * {@link #values} is empty. */
  public static class AnnAssign extends SimpleStmt {
    public final List<Exp> targets;
    public final Exp annotation;
    public final List<Exp> values;

    AnnAssign(Pos pos, ImmutableList<Exp> targets, Exp annotation,
        ImmutableList<Exp> values) {
      super(pos, Op.ANN_ASSIGN);
      this.targets = requireNonNull(targets);
      this.annotation = requireNonNull(annotation);
      this.values = requireNonNull(values);
      checkArgument(!targets.isEmpty());
    }

    @Override
    AstWriter writeLine(AstWriter w) {
      w.commaList(targets).append(": ").exp(annotation);
      return values.isEmpty() ? w : w.append(" = ").stmtList(values);
    }
  }

  /** Augmented assignment, e.g. "x += 1". The op is one of the augmented
   * assignment operators, such as {@link Op#PLUS_ASSIGN}. */
  public static class AugAssign extends SimpleStmt {
    public final Op assignOp;
    public final List<Exp> targets;
    public final List<Exp> values;

    AugAssign(Pos pos, Op assignOp, ImmutableList<Exp> targets,
        ImmutableList<Exp> values) {
      super(pos, Op.AUG_ASSIGN);
      this.assignOp = requireNonNull(assignOp);
      this.targets = requireNonNull(targets);
      this.values = requireNonNull(values);
      checkArgument(assignOp.kind == Op.Kind.AUGMENTED,
          "not an augmented assignment operator: %s", assignOp);
      checkArgument(!targets.isEmpty());
      checkArgument(!values.isEmpty());
    }

    @Override
    AstWriter writeLine(AstWriter w) {
      return w.commaList(targets).append(assignOp.padded).stmtList(values);
    }
  }

  //~ Compound statements -----------------------------------------------------

  /** Base class of statements that contain blocks of statements. Each
   * writes its header lines at the current indentation and its blocks one
   * level deeper. */
  public abstract static class CompoundStmt extends Stmt {
    CompoundStmt(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Condition and block of one branch of an "if" statement. Writes
   * "condition:", a line break, and the block. */
  public static class IfBranch extends AstNode {
    public final Exp condition;
    public final List<Stmt> block;

    IfBranch(Pos pos, Exp condition, ImmutableList<Stmt> block) {
      super(pos, Op.IF_BRANCH);
      this.condition = requireNonNull(condition);
      this.block = checkBlock(block, "if");
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.exp(condition).append(":").newline().block(block);
    }
  }

  /** "if" statement, with zero or more "elif" branches and an optional
   * "else" block. */
  public static class If extends CompoundStmt {
    public final List<IfBranch> branches;
    public final @Nullable List<Stmt> orElse;

    If(Pos pos, ImmutableList<IfBranch> branches,
        @Nullable ImmutableList<Stmt> orElse) {
      super(pos, Op.IF);
      this.branches = requireNonNull(branches);
      this.orElse = orElse == null ? null : checkBlock(orElse, "else");
      checkArgument(!branches.isEmpty(), "if requires at least one branch");
    }

    @Override
    AstWriter write(AstWriter w) {
      for (int i = 0; i < branches.size(); i++) {
        w.indent().append(i == 0 ? "if " : "elif ").append(branches.get(i));
      }
      return orElse == null ? w : w.clause("else", orElse);
    }
  }

  /** "for" statement, e.g. "for k, v in d.items(): ...". */
  public static class For extends CompoundStmt {
    public final boolean async;
    public final List<Exp> targets;
    public final List<Exp> iterables;
    public final List<Stmt> body;
    public final @Nullable List<Stmt> orElse;

    For(Pos pos, boolean async, ImmutableList<Exp> targets,
        ImmutableList<Exp> iterables, ImmutableList<Stmt> body,
        @Nullable ImmutableList<Stmt> orElse) {
      super(pos, Op.FOR);
      this.async = async;
      this.targets = requireNonNull(targets);
      this.iterables = requireNonNull(iterables);
      this.body = checkBlock(body, "for");
      this.orElse = orElse == null ? null : checkBlock(orElse, "else");
      checkArgument(!targets.isEmpty());
      checkArgument(!iterables.isEmpty());
    }

    @Override
    AstWriter write(AstWriter w) {
      w.indent()
          .append(async ? "async for " : "for ")
          .targets(targets)
          .append(" in ")
          .expList(iterables)
          .append(":")
          .newline()
          .block(body);
      return orElse == null ? w : w.clause("else", orElse);
    }
  }

  /** "while" statement. */
  public static class While extends CompoundStmt {
    public final Exp condition;
    public final List<Stmt> body;
    public final @Nullable List<Stmt> orElse;

    While(Pos pos, Exp condition, ImmutableList<Stmt> body,
        @Nullable ImmutableList<Stmt> orElse) {
      super(pos, Op.WHILE);
      this.condition = requireNonNull(condition);
      this.body = checkBlock(body, "while");
      this.orElse = orElse == null ? null : checkBlock(orElse, "else");
    }

    @Override
    AstWriter write(AstWriter w) {
      w.clause("while", condition, body);
      return orElse == null ? w : w.clause("else", orElse);
    }
  }

  /** Context manager in a "with" statement, e.g. "open(f) as fp". */
  public static class WithItem extends AstNode {
    public final Exp context;
    public final @Nullable Exp binding;

    WithItem(Pos pos, Exp context, @Nullable Exp binding) {
      super(pos, Op.WITH_ITEM);
      this.context = requireNonNull(context);
      this.binding = binding;
    }

    @Override
    AstWriter write(AstWriter w) {
      if (context.op == Op.TUPLE) {
        // "with (a, b):" would read back as two items
        w.append("(").append(context).append(")");
      } else {
        w.exp(context);
      }
      return binding == null ? w : w.append(" as ").target(binding);
    }
  }

  /** "with" statement, e.g. "with a as b, c: ...". */
  public static class With extends CompoundStmt {
    public final List<WithItem> items;
    public final List<Stmt> body;

    With(Pos pos, ImmutableList<WithItem> items, ImmutableList<Stmt> body) {
      super(pos, Op.WITH);
      this.items = requireNonNull(items);
      this.body = checkBlock(body, "with");
      checkArgument(!items.isEmpty(), "with requires at least one item");
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.indent().append("with ").commaList(items).append(":")
          .newline().block(body);
    }
  }

  /** Function definition, with its decorators. */
  public static class FunDef extends CompoundStmt {
    public final List<Decorator> decorators;
    public final boolean async;
    public final String name;
    public final Parameters parameters;
    public final @Nullable Exp returnType;
    public final List<Stmt> body;

    FunDef(Pos pos, ImmutableList<Decorator> decorators, boolean async,
        String name, Parameters parameters, @Nullable Exp returnType,
        ImmutableList<Stmt> body) {
      super(pos, Op.FUN_DEF);
      this.decorators = requireNonNull(decorators);
      this.async = async;
      this.name = requireNonNull(name);
      this.parameters = requireNonNull(parameters);
      this.returnType = returnType;
      this.body = checkBlock(body, "def");
    }

    @Override
    AstWriter write(AstWriter w) {
      w.appendAll(decorators, "");
      w.indent()
          .append(async ? "async def " : "def ")
          .id(name)
          .append("(")
          .append(parameters)
          .append(")");
      if (returnType != null) {
        w.append(" -> ").exp(returnType);
      }
      return w.append(":").newline().block(body);
    }
  }

  /** Class definition.
   *
   * <p>The writer does not support class definitions yet; writing one
   * throws {@link UnsupportedConstructException}. */
  public static class ClassDef extends CompoundStmt {
    public final List<Decorator> decorators;
    public final String name;
    public final @Nullable Arglist bases;
    public final List<Stmt> body;

    ClassDef(Pos pos, ImmutableList<Decorator> decorators, String name,
        @Nullable Arglist bases, ImmutableList<Stmt> body) {
      super(pos, Op.CLASS_DEF);
      this.decorators = requireNonNull(decorators);
      this.name = requireNonNull(name);
      this.bases = bases;
      this.body = checkBlock(body, "class");
    }

    @Override
    AstWriter write(AstWriter w) {
      throw new UnsupportedConstructException(this,
          "cannot write class " + name);
    }
  }

  /** Typed "except" clause of a "try" statement, e.g.
   * "except ValueError as e:" and its block. */
  public static class ExceptClause extends AstNode {
    public final Exp guard;
    public final @Nullable String name;
    public final List<Stmt> block;

    ExceptClause(Pos pos, Exp guard, @Nullable String name,
        ImmutableList<Stmt> block) {
      super(pos, Op.EXCEPT_CLAUSE);
      this.guard = requireNonNull(guard);
      this.name = name;
      this.block = checkBlock(block, "except");
    }

    @Override
    AstWriter write(AstWriter w) {
      w.indent().append("except ").exp(guard);
      if (name != null) {
        w.append(" as ").id(name);
      }
      return w.append(":").newline().block(block);
    }
  }

  /** "try" statement.
   *
   * <p>An empty {@link #bareExcept}, {@link #orElse} or {@link #finalBody}
   * means that the statement has no such clause. */
  public static class Try extends CompoundStmt {
    public final List<Stmt> body;
    public final List<ExceptClause> excepts;
    public final List<Stmt> bareExcept;
    public final List<Stmt> orElse;
    public final List<Stmt> finalBody;

    Try(Pos pos, ImmutableList<Stmt> body, ImmutableList<ExceptClause> excepts,
        ImmutableList<Stmt> bareExcept, ImmutableList<Stmt> orElse,
        ImmutableList<Stmt> finalBody) {
      super(pos, Op.TRY);
      this.body = checkBlock(body, "try");
      this.excepts = requireNonNull(excepts);
      this.bareExcept = requireNonNull(bareExcept);
      this.orElse = requireNonNull(orElse);
      this.finalBody = requireNonNull(finalBody);
      final boolean hasExcept = !excepts.isEmpty() || !bareExcept.isEmpty();
      checkArgument(hasExcept || !finalBody.isEmpty(),
          "try requires except or finally");
      checkArgument(hasExcept || orElse.isEmpty(),
          "else in try requires except");
    }

    @Override
    AstWriter write(AstWriter w) {
      w.clause("try", body);
      w.appendAll(excepts, "");
      if (!bareExcept.isEmpty()) {
        w.clause("except", bareExcept);
      }
      if (!orElse.isEmpty()) {
        w.clause("else", orElse);
      }
      if (!finalBody.isEmpty()) {
        w.clause("finally", finalBody);
      }
      return w;
    }
  }
}

// End Ast.java
