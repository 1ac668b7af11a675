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

import static net.hydromatic.pyunparse.Matchers.isAst;
import static net.hydromatic.pyunparse.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for converting statements and blocks to source text. */
public class StatementTest {
  private static final Pos P = Pos.ZERO;

  private static Ast.Id id(String name) {
    return ast.id(P, name);
  }

  private static Ast.Literal intLiteral(long value) {
    return ast.intLiteral(P, value);
  }

  private static List<Ast.Stmt> pass() {
    return ImmutableList.of(ast.pass(P));
  }

  private static Ast.Alias alias(String name, String asName) {
    return ast.alias(P, ImmutableList.of(name), asName);
  }

  @Test
  void testReturn() {
    assertThat(
        ast.returnStmt(P, ImmutableList.of(intLiteral(1), intLiteral(2))),
        isAst("return 1, 2\n"));
    assertThat(ast.returnStmt(P, ImmutableList.of()), isAst("return\n"));
    assertThat(
        ast.returnStmt(P,
            ImmutableList.of(ast.yieldExp(P, ImmutableList.of(id("x"))))),
        isAst("return (yield x)\n"));
  }

  @Test
  void testSimpleStatements() {
    assertThat(ast.pass(P), isAst("pass\n"));
    assertThat(ast.breakStmt(P), isAst("break\n"));
    assertThat(ast.continueStmt(P), isAst("continue\n"));
    assertThat(ast.del(P, ImmutableList.of("a", "b")), isAst("del a, b\n"));
    assertThat(ast.global(P, ImmutableList.of("a", "b")),
        isAst("global a, b\n"));
    assertThat(ast.nonlocal(P, ImmutableList.of("x")),
        isAst("nonlocal x\n"));
    assertThat(ast.assertStmt(P, id("x"), null), isAst("assert x\n"));
    assertThat(
        ast.assertStmt(P, ast.infixCall(P, Op.GT, id("x"), intLiteral(0)),
            ast.stringLiteral(P, "positive")),
        isAst("assert x>0, \"positive\"\n"));
    assertThat(ast.expStmt(P, ast.call(P, id("f"), id("x"))),
        isAst("f(x)\n"));
    assertThat(ast.expStmt(P, ast.yieldExp(P, ImmutableList.of(id("x")))),
        isAst("yield x\n"));
  }

  @Test
  void testRaise() {
    assertThat(ast.raise(P, null, null), isAst("raise\n"));
    assertThat(ast.raise(P, ast.call(P, id("ValueError")), null),
        isAst("raise ValueError()\n"));
    assertThat(ast.raise(P, id("e"), id("cause")),
        isAst("raise e from cause\n"));
    assertThrows(IllegalArgumentException.class,
        () -> ast.raise(P, null, id("cause")));
  }

  @Test
  void testAssignments() {
    assertThat(ast.assign(P, id("a"), intLiteral(1)), isAst("a = 1\n"));
    assertThat(
        ast.assign(P, ImmutableList.of(id("a"), id("b")),
            ImmutableList.of(ImmutableList.of(id("c")),
                ImmutableList.of(id("d"), id("e")))),
        isAst("a, b = c = d, e\n"));
    assertThat(
        ast.assign(P, ImmutableList.of(id("first"), ast.star(P, id("rest"))),
            ImmutableList.of(ImmutableList.of(id("xs")))),
        isAst("first, *rest = xs\n"));
    assertThat(
        ast.assign(P, ast.subscript(P, id("a"), ast.index(P, intLiteral(0))),
            ast.yieldExp(P, ImmutableList.of())),
        isAst("a[0] = yield\n"));
    assertThat(
        ast.annAssign(P, ImmutableList.of(id("x")), id("int"),
            ImmutableList.of()),
        isAst("x: int\n"));
    assertThat(
        ast.annAssign(P, ImmutableList.of(id("x")), id("int"),
            ImmutableList.of(intLiteral(0))),
        isAst("x: int = 0\n"));
    assertThat(
        ast.augAssign(P, ImmutableList.of(id("x")), Op.PLUS,
            ImmutableList.of(intLiteral(1))),
        isAst("x += 1\n"));
    assertThat(
        ast.augAssign(P, ImmutableList.of(id("x")), Op.FLOOR_DIVIDE_ASSIGN,
            ImmutableList.of(intLiteral(2))),
        isAst("x //= 2\n"));
    assertThat(
        ast.augAssign(P, ImmutableList.of(id("x")), Op.POWER,
            ImmutableList.of(ast.plus(id("y"), intLiteral(1)))),
        isAst("x **= y+1\n"));
    assertThrows(AssertionError.class,
        () -> ast.augAssign(P, ImmutableList.of(id("x")), Op.AND,
            ImmutableList.of(id("y"))));
  }

  /** A yield is written bare only if it is the only value on its side of
   * the statement; otherwise "yield a, b" would read back as one yield of a
   * tuple. */
  @Test
  void testYieldAmongValues() {
    final Ast.Exp yieldNone = ast.yieldExp(P, ImmutableList.of());
    final Ast.Exp yieldA = ast.yieldExp(P, ImmutableList.of(id("a")));
    assertThat(ast.expStmt(P, yieldNone, id("b")),
        isAst("(yield), b\n"));
    assertThat(ast.expStmt(P, yieldA, id("b")),
        isAst("(yield a), b\n"));
    assertThat(ast.expStmt(P, id("b"), ast.yieldFrom(P, id("g"))),
        isAst("b, (yield from g)\n"));
    assertThat(
        ast.assign(P, ImmutableList.of(id("x")),
            ImmutableList.of(ImmutableList.of(yieldA, id("b")))),
        isAst("x = (yield a), b\n"));
    assertThat(
        ast.assign(P, ImmutableList.of(id("x")),
            ImmutableList.of(ImmutableList.of(yieldA),
                ImmutableList.of(id("b"), yieldA))),
        isAst("x = yield a = b, (yield a)\n"));
    assertThat(
        ast.annAssign(P, ImmutableList.of(id("x")), id("tuple"),
            ImmutableList.of(yieldA, id("b"))),
        isAst("x: tuple = (yield a), b\n"));
    assertThat(
        ast.augAssign(P, ImmutableList.of(id("x")), Op.PLUS,
            ImmutableList.of(yieldA)),
        isAst("x += yield a\n"));
    assertThat(
        ast.augAssign(P, ImmutableList.of(id("x")), Op.PLUS,
            ImmutableList.of(yieldA, id("b"))),
        isAst("x += (yield a), b\n"));
  }

  @Test
  void testAugAssignByName() {
    assertThat(
        ast.augAssign(P, ImmutableList.of(id("x")), "+=",
            ImmutableList.of(intLiteral(1))),
        isAst("x += 1\n"));
    assertThat(
        ast.augAssign(P, ImmutableList.of(id("x")), "<<",
            ImmutableList.of(intLiteral(2))),
        isAst("x <<= 2\n"));
    assertThrows(IllegalArgumentException.class,
        () -> ast.augAssign(P, ImmutableList.of(id("x")), "pass",
            ImmutableList.of(intLiteral(1))));
    assertThrows(IllegalArgumentException.class,
        () -> ast.augAssign(P, ImmutableList.of(id("x")), "?=",
            ImmutableList.of(intLiteral(1))));
  }

  @Test
  void testImportFrom() {
    assertThat(
        ast.importFrom(P, 2, ImmutableList.of("pkg"),
            ImmutableList.of(alias("x", null))),
        isAst("from ..pkg import x\n"));
    assertThat(
        ast.importFrom(P, 0, ImmutableList.of("os", "path"),
            ImmutableList.of(alias("join", null), alias("exists", "e"))),
        isAst("from os.path import join, exists as e\n"));
    assertThat(
        ast.importFrom(P, 0, ImmutableList.of("m"), ImmutableList.of()),
        isAst("from m import *\n"));
    assertThat(
        ast.importFrom(P, 1, ImmutableList.of(),
            ImmutableList.of(alias("x", null))),
        isAst("from . import x\n"));

    // An imported name is not dotted
    assertThrows(IllegalArgumentException.class,
        () -> ast.importFrom(P, 0, ImmutableList.of("m"),
            ImmutableList.of(ast.alias(P, ImmutableList.of("a", "b"), null))));
    // A non-relative import needs a module
    assertThrows(IllegalArgumentException.class,
        () -> ast.importFrom(P, 0, ImmutableList.of(),
            ImmutableList.of(alias("x", null))));
  }

  @Test
  void testImport() {
    assertThat(
        ast.importStmt(P,
            ImmutableList.of(
                ast.alias(P, ImmutableList.of("os", "path"), "p"),
                alias("sys", null))),
        isAst("import os.path as p, sys\n"));
    assertThrows(IllegalArgumentException.class,
        () -> ast.importStmt(P, ImmutableList.of()));
  }

  @Test
  void testIf() {
    final Ast.If ifStmt =
        ast.ifStmt(P,
            ImmutableList.of(
                ast.ifBranch(P, id("c1"), pass()),
                ast.ifBranch(P, id("c2"),
                    ImmutableList.of(ast.breakStmt(P)))),
            ImmutableList.of(ast.continueStmt(P)));
    assertThat(ifStmt,
        isAst("if c1:\n"
            + "    pass\n"
            + "elif c2:\n"
            + "    break\n"
            + "else:\n"
            + "    continue\n"));

    assertThat(
        ast.ifStmt(P, ImmutableList.of(ast.ifBranch(P, id("c"), pass())),
            null),
        isAst("if c:\n    pass\n"));
    assertThrows(IllegalArgumentException.class,
        () -> ast.ifStmt(P, ImmutableList.of(), pass()));
    // An "else" block, if present, is not empty
    assertThrows(IllegalArgumentException.class,
        () -> ast.ifStmt(P,
            ImmutableList.of(ast.ifBranch(P, id("c"), pass())),
            ImmutableList.of()));
  }

  @Test
  void testFor() {
    final Ast.Exp items = ast.call(P, ast.attribute(P, id("d"), "items"));
    assertThat(
        ast.forStmt(P, false, ImmutableList.of(id("k"), id("v")),
            ImmutableList.of(items), pass(),
            ImmutableList.of(ast.breakStmt(P))),
        isAst("for k, v in d.items():\n"
            + "    pass\n"
            + "else:\n"
            + "    break\n"));
    assertThat(
        ast.forStmt(P, true,
            ImmutableList.of(ast.attribute(P, id("self"), "x")),
            ImmutableList.of(id("xs")), pass(), null),
        isAst("async for self.x in xs:\n    pass\n"));
    assertThat(
        ast.forStmt(P, false, ImmutableList.of(id("x")),
            ImmutableList.of(id("a"), id("b")), pass(), null),
        isAst("for x in a, b:\n    pass\n"));
  }

  @Test
  void testWhile() {
    assertThat(
        ast.whileStmt(P, ast.infixCall(P, Op.GT, id("x"), intLiteral(0)),
            ImmutableList.of(
                ast.augAssign(P, ImmutableList.of(id("x")), Op.MINUS,
                    ImmutableList.of(intLiteral(1)))),
            pass()),
        isAst("while x>0:\n"
            + "    x -= 1\n"
            + "else:\n"
            + "    pass\n"));
    assertThrows(IllegalArgumentException.class,
        () -> ast.whileStmt(P, id("x"), ImmutableList.of(), null));
  }

  @Test
  void testWith() {
    assertThat(
        ast.with(P,
            ImmutableList.of(
                ast.withItem(P, ast.call(P, id("open"), id("f")), id("fp")),
                ast.withItem(P, id("lock"), null)),
            pass()),
        isAst("with open(f) as fp, lock:\n    pass\n"));

    // A tuple context gets a second pair of parentheses, so that it does
    // not read back as two items
    assertThat(
        ast.with(P,
            ImmutableList.of(
                ast.withItem(P,
                    ast.tuple(P, ast.item(P, id("a")), ast.item(P, id("b"))),
                    null)),
            pass()),
        isAst("with ((a, b)):\n    pass\n"));
    assertThat(
        ast.with(P,
            ImmutableList.of(
                ast.withItem(P, ast.tuple(P, ast.item(P, id("a"))),
                    id("t"))),
            pass()),
        isAst("with ((a,)) as t:\n    pass\n"));
  }

  @Test
  void testFunDef() {
    final Ast.Parameters parameters =
        ast.parameters(P, true,
            ImmutableList.of(ast.param(P, "x", id("int"), null)));
    final Ast.FunDef funDef =
        ast.funDef(P,
            ImmutableList.of(
                ast.decorator(P, ImmutableList.of("staticmethod"), null),
                ast.decorator(P, ImmutableList.of("app", "route"),
                    ast.arglist(P,
                        ImmutableList.of(
                            ast.arg(P, ast.stringLiteral(P, "/"))),
                        ImmutableList.of()))),
            true, "f", parameters, id("str"),
            ImmutableList.of(ast.returnStmt(P, ImmutableList.of(id("x")))));
    assertThat(funDef,
        isAst("@staticmethod\n"
            + "@app.route(\"/\")\n"
            + "async def f(x:int) -> str:\n"
            + "    return x\n"));

    final Ast.FunDef simple =
        ast.funDef(P, ImmutableList.of(), false, "g",
            ast.parameters(P, true, ImmutableList.of()), null, pass());
    assertThat(simple, isAst("def g():\n    pass\n"));

    // Function parameters are typed; lambda parameters are not
    assertThrows(IllegalArgumentException.class,
        () -> ast.funDef(P, ImmutableList.of(), false, "g",
            ast.parameters(P, false, ImmutableList.of()), null, pass()));
  }

  /** Empty "except", "else" and "finally" sections are omitted. */
  @Test
  void testTry() {
    final Ast.ExceptClause valueError =
        ast.exceptClause(P, id("ValueError"), "e",
            ImmutableList.of(ast.raise(P, null, null)));
    assertThat(
        ast.tryStmt(P, pass(), ImmutableList.of(valueError),
            ImmutableList.of(), ImmutableList.of(), ImmutableList.of()),
        isAst("try:\n"
            + "    pass\n"
            + "except ValueError as e:\n"
            + "    raise\n"));

    final Ast.ExceptClause keyError =
        ast.exceptClause(P, id("KeyError"), null, pass());
    final Ast.ExceptClause tupleGuard =
        ast.exceptClause(P,
            ast.tuple(P, ast.items(ImmutableList.of(id("A"), id("B")))),
            null, pass());
    assertThat(
        ast.tryStmt(P, pass(), ImmutableList.of(keyError, tupleGuard),
            ImmutableList.of(ast.breakStmt(P)),
            ImmutableList.of(ast.continueStmt(P)),
            ImmutableList.of(ast.expStmt(P, ast.call(P, id("close"))))),
        isAst("try:\n"
            + "    pass\n"
            + "except KeyError:\n"
            + "    pass\n"
            + "except (A, B):\n"
            + "    pass\n"
            + "except:\n"
            + "    break\n"
            + "else:\n"
            + "    continue\n"
            + "finally:\n"
            + "    close()\n"));

    assertThat(
        ast.tryStmt(P, pass(), ImmutableList.of(), ImmutableList.of(),
            ImmutableList.of(), pass()),
        isAst("try:\n    pass\nfinally:\n    pass\n"));

    assertThrows(IllegalArgumentException.class,
        () -> ast.tryStmt(P, pass(), ImmutableList.of(), ImmutableList.of(),
            ImmutableList.of(), ImmutableList.of()));
    assertThrows(IllegalArgumentException.class,
        () -> ast.tryStmt(P, pass(), ImmutableList.of(), ImmutableList.of(),
            pass(), pass()));
  }

  /** Each level of nesting adds exactly one indent, and sibling blocks
   * return to the same indent. */
  @Test
  void testNestedIndentation() {
    final Ast.Stmt ifStmt =
        ast.ifStmt(P,
            ImmutableList.of(
                ast.ifBranch(P, id("y"),
                    ImmutableList.of(
                        ast.returnStmt(P, ImmutableList.of(id("y")))))),
            null);
    final Ast.Stmt forStmt =
        ast.forStmt(P, false, ImmutableList.of(id("y")),
            ImmutableList.of(id("x")), ImmutableList.of(ifStmt), pass());
    final Ast.FunDef funDef =
        ast.funDef(P, ImmutableList.of(), false, "f",
            ast.parameters(P, true, ImmutableList.of(ast.param(P, "x"))),
            null,
            ImmutableList.of(forStmt,
                ast.returnStmt(P, ImmutableList.of(ast.none(P)))));
    final String expected = "def f(x):\n"
        + "    for y in x:\n"
        + "        if y:\n"
        + "            return y\n"
        + "    else:\n"
        + "        pass\n"
        + "    return None\n";
    assertThat(funDef, isAst(expected));

    assertThat(funDef.unparse(new AstWriter(2, 100, '"')),
        is("def f(x):\n"
            + "  for y in x:\n"
            + "    if y:\n"
            + "      return y\n"
            + "  else:\n"
            + "    pass\n"
            + "  return None\n"));
  }

  /** Class definitions cannot be written yet. */
  @Test
  void testClassDef() {
    final Ast.ClassDef classDef =
        ast.classDef(P, ImmutableList.of(), "C", null, pass());
    final UnsupportedConstructException e =
        assertThrows(UnsupportedConstructException.class, classDef::toString);
    assertThat(e.op, is(Op.CLASS_DEF));
    assertThat(e.getMessage(),
        is("unsupported construct class_def: cannot write class C"));

    // Also when nested
    final Ast.If ifStmt =
        ast.ifStmt(P,
            ImmutableList.of(
                ast.ifBranch(P, id("c"), ImmutableList.of(classDef))),
            null);
    assertThrows(UnsupportedConstructException.class, ifStmt::toString);
  }
}

// End StatementTest.java
