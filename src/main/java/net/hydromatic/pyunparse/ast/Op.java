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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Locale;

/**
 * Sub-types of {@link AstNode}.
 *
 * <p>Operators carry the text they are written with, but no precedence or
 * associativity: the writer parenthesizes every operand that is not an atom,
 * so it never needs to compare operators.
 */
public enum Op {
  // identifiers
  ID(true),

  // literals
  ELLIPSIS_LITERAL(true),
  NONE_LITERAL(true),
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  FLOAT_LITERAL(true),
  COMPLEX_LITERAL(true),
  STRING_LITERAL(true),
  BYTES_LITERAL(true),

  // displays and comprehensions
  DICT(true),
  SET(true),
  LIST(true),
  TUPLE(true),
  DICT_COMP(true),
  SET_COMP(true),
  LIST_COMP(true),
  GENERATOR(true),

  // trailers
  CALL,
  SUBSCRIPT,
  ATTRIBUTE,

  // prefix operators
  POSITIVE(Kind.PREFIX, "+"),
  NEGATE(Kind.PREFIX, "-"),
  INVERT(Kind.PREFIX, "~"),
  NOT(Kind.PREFIX, "not "),

  // infix operators
  POWER(Kind.INFIX, "**"),
  TIMES(Kind.INFIX, "*"),
  MATMUL(Kind.INFIX, "@"),
  DIVIDE(Kind.INFIX, "/"),
  FLOOR_DIVIDE(Kind.INFIX, "//"),
  MOD(Kind.INFIX, "%"),
  PLUS(Kind.INFIX, "+"),
  MINUS(Kind.INFIX, "-"),
  LSHIFT(Kind.INFIX, "<<"),
  RSHIFT(Kind.INFIX, ">>"),
  BIT_AND(Kind.INFIX, "&"),
  BIT_XOR(Kind.INFIX, "^"),
  BIT_OR(Kind.INFIX, "|"),
  LT(Kind.INFIX, "<"),
  GT(Kind.INFIX, ">"),
  EQ(Kind.INFIX, "=="),
  LE(Kind.INFIX, "<="),
  GE(Kind.INFIX, ">="),
  NE(Kind.INFIX, "!="),
  IN(Kind.INFIX, " in "),
  NOT_IN(Kind.INFIX, " not in "),
  IS(Kind.INFIX, " is "),
  IS_NOT(Kind.INFIX, " is not "),
  AND(Kind.INFIX, " and "),
  OR(Kind.INFIX, " or "),

  // other expressions
  TERNARY,
  YIELD,
  YIELD_FROM,
  STAR,
  LAMBDA,

  // parts of expressions and statements
  ITEM,
  DICT_ITEM,
  COMP_FOR,
  COMP_IF,
  INDEX,
  SLICE,
  ARG,
  KEYWORD_ARG,
  ARGLIST,
  PARAM,
  PARAMETERS,
  DECORATOR,
  ALIAS,
  IF_BRANCH,
  WITH_ITEM,
  EXCEPT_CLAUSE,

  // augmented assignment operators
  PLUS_ASSIGN(Kind.AUGMENTED, " += "),
  MINUS_ASSIGN(Kind.AUGMENTED, " -= "),
  TIMES_ASSIGN(Kind.AUGMENTED, " *= "),
  MATMUL_ASSIGN(Kind.AUGMENTED, " @= "),
  DIVIDE_ASSIGN(Kind.AUGMENTED, " /= "),
  MOD_ASSIGN(Kind.AUGMENTED, " %= "),
  BIT_AND_ASSIGN(Kind.AUGMENTED, " &= "),
  BIT_OR_ASSIGN(Kind.AUGMENTED, " |= "),
  BIT_XOR_ASSIGN(Kind.AUGMENTED, " ^= "),
  LSHIFT_ASSIGN(Kind.AUGMENTED, " <<= "),
  RSHIFT_ASSIGN(Kind.AUGMENTED, " >>= "),
  POWER_ASSIGN(Kind.AUGMENTED, " **= "),
  FLOOR_DIVIDE_ASSIGN(Kind.AUGMENTED, " //= "),

  // simple statements
  PASS(Kind.KEYWORD, "pass"),
  BREAK(Kind.KEYWORD, "break"),
  CONTINUE(Kind.KEYWORD, "continue"),
  DEL,
  RETURN,
  RAISE,
  GLOBAL(Kind.DECLARE, "global "),
  NONLOCAL(Kind.DECLARE, "nonlocal "),
  ASSERT,
  IMPORT,
  IMPORT_FROM,
  EXP_STMT,
  ASSIGN,
  ANN_ASSIGN,
  AUG_ASSIGN,

  // compound statements
  IF,
  FOR,
  WHILE,
  WITH,
  FUN_DEF,
  CLASS_DEF,
  TRY;

  /** Text of the operator, e.g. "+" or " not in ". Null if the node is not
   * an operator or keyword. */
  public final String padded;
  /** Whether an expression of this kind may appear as an operand without
   * parentheses. */
  public final boolean atom;
  public final Kind kind;

  /** Map of operators and keywords by their text, e.g. "+=" to
   * {@link #PLUS_ASSIGN}. Prefix operators are keyed with a "u" prefix,
   * e.g. "u-" to {@link #NEGATE}, so as not to clash with infix ones. */
  public static final ImmutableMap<String, Op> BY_OP_NAME;

  /** Operators that can be applied to one operand. */
  public static final ImmutableSet<Op> PREFIX_OPS;

  /** Operators that can be applied to two operands. */
  public static final ImmutableSet<Op> INFIX_OPS;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    final ImmutableSet.Builder<Op> prefixOps = ImmutableSet.builder();
    final ImmutableSet.Builder<Op> infixOps = ImmutableSet.builder();
    for (Op op : values()) {
      switch (op.kind) {
        case PREFIX:
          b.put("u" + op.padded.trim(), op);
          prefixOps.add(op);
          break;
        case INFIX:
          b.put(op.padded.trim(), op);
          infixOps.add(op);
          break;
        case AUGMENTED:
        case KEYWORD:
        case DECLARE:
          b.put(op.padded.trim(), op);
          break;
        default:
          break;
      }
    }
    BY_OP_NAME = b.build();
    PREFIX_OPS = prefixOps.build();
    INFIX_OPS = infixOps.build();
  }

  Op() {
    this(Kind.NODE, null, false);
  }

  Op(boolean atom) {
    this(Kind.NODE, null, atom);
    assert atom;
  }

  Op(Kind kind, String padded) {
    this(kind, padded, false);
  }

  Op(Kind kind, String padded, boolean atom) {
    this.kind = kind;
    this.padded = padded;
    this.atom = atom;
  }

  /** Returns the name of this op in lower case, e.g. "class_def". */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Converts an arithmetic or bitwise operator to the corresponding
   * augmented assignment operator, e.g. {@link #PLUS} to
   * {@link #PLUS_ASSIGN}. */
  public Op toAugmented() {
    switch (this) {
      case PLUS:
        return PLUS_ASSIGN;
      case MINUS:
        return MINUS_ASSIGN;
      case TIMES:
        return TIMES_ASSIGN;
      case MATMUL:
        return MATMUL_ASSIGN;
      case DIVIDE:
        return DIVIDE_ASSIGN;
      case MOD:
        return MOD_ASSIGN;
      case BIT_AND:
        return BIT_AND_ASSIGN;
      case BIT_OR:
        return BIT_OR_ASSIGN;
      case BIT_XOR:
        return BIT_XOR_ASSIGN;
      case LSHIFT:
        return LSHIFT_ASSIGN;
      case RSHIFT:
        return RSHIFT_ASSIGN;
      case POWER:
        return POWER_ASSIGN;
      case FLOOR_DIVIDE:
        return FLOOR_DIVIDE_ASSIGN;
      default:
        throw new AssertionError("unknown op " + this);
    }
  }

  /** Category of op. */
  public enum Kind {
    /** A node that is not an operator. */
    NODE,
    PREFIX,
    INFIX,
    AUGMENTED,
    /** Statement that consists of a keyword only, e.g. "pass". */
    KEYWORD,
    /** Statement that declares the scope of names, e.g. "global". */
    DECLARE
  }
}

// End Op.java
