package ai.pyscript.analyser.classify;

import static org.assertj.core.api.Assertions.assertThat;

import ai.pyscript.analyser.source.Line;
import org.junit.jupiter.api.Test;

class LineClassifierTest {

    @Test
    void countsLeadingSpacesAndTabsAsOneUnitEach() {
        assertThat(LineClassifier.indentationLength("x = 1")).isZero();
        assertThat(LineClassifier.indentationLength("    x")).isEqualTo(4);
        assertThat(LineClassifier.indentationLength("\t\tx")).isEqualTo(2);
        assertThat(LineClassifier.indentationLength(" \t x")).isEqualTo(3);
        assertThat(LineClassifier.indentationLength("   ")).isEqualTo(3);
        assertThat(LineClassifier.indentationLength("")).isZero();
    }

    @Test
    void resolvesImportAliases() {
        assertThat(LineClassifier.matchImport(line("import sys, re as regex")))
                .hasValueSatisfying(names -> assertThat(names).containsExactly("sys", "regex"));
        assertThat(LineClassifier.matchImport(line("import numpy as np")))
                .hasValueSatisfying(names -> assertThat(names).containsExactly("np"));
    }

    @Test
    void fromImportDiscardsModuleName() {
        assertThat(LineClassifier.matchImport(line("from sys import argv as cmd_args")))
                .hasValueSatisfying(names -> assertThat(names).containsExactly("cmd_args"));
        assertThat(LineClassifier.matchImport(line("from __future__ import annotations")))
                .hasValueSatisfying(names -> assertThat(names).containsExactly("annotations"));
        assertThat(LineClassifier.matchImport(line("from . import sibling")))
                .hasValueSatisfying(names -> assertThat(names).containsExactly("sibling"));
        assertThat(LineClassifier.matchImport(line("from m import (a, b as c)")))
                .hasValueSatisfying(names -> assertThat(names).containsExactly("a", "c"));
    }

    @Test
    void ignoresTrailingCommentOnImport() {
        assertThat(LineClassifier.matchImport(line("import math             # Module for math functions.")))
                .hasValueSatisfying(names -> assertThat(names).containsExactly("math"));
        assertThat(LineClassifier.matchImport(line("from os import listdir  # Function for listing.")))
                .hasValueSatisfying(names -> assertThat(names).containsExactly("listdir"));
    }

    @Test
    void dropsMalformedAliasButKeepsOtherNames() {
        assertThat(LineClassifier.matchImport(line("import a as b c, d")))
                .hasValueSatisfying(names -> assertThat(names).containsExactly("d"));
        assertThat(LineClassifier.matchImport(line("import x as")))
                .hasValueSatisfying(names -> assertThat(names).isEmpty());
    }

    @Test
    void rejectsNonImportLines() {
        assertThat(LineClassifier.matchImport(line("important = 5"))).isEmpty();
        assertThat(LineClassifier.matchImport(line("print('import x')"))).isEmpty();
        assertThat(LineClassifier.matchImport(line("from x"))).isEmpty();
    }

    @Test
    void recognizesGlobalAssignmentShape() {
        assertThat(LineClassifier.matchGlobalAssignmentShape("GLOB = 5")).isTrue();
        assertThat(LineClassifier.matchGlobalAssignmentShape("x: int = 5")).isTrue();
        assertThat(LineClassifier.matchGlobalAssignmentShape("obj.attr=1")).isTrue();
        assertThat(LineClassifier.matchGlobalAssignmentShape("    x = 1")).isFalse();
        assertThat(LineClassifier.matchGlobalAssignmentShape("x == 1")).isFalse();
        assertThat(LineClassifier.matchGlobalAssignmentShape("if a == b:")).isFalse();
        assertThat(LineClassifier.matchGlobalAssignmentShape("x += 1")).isFalse();
        assertThat(LineClassifier.matchGlobalAssignmentShape("items[0] = 1")).isFalse();
        assertThat(LineClassifier.matchGlobalAssignmentShape("print(x)")).isFalse();
    }

    @Test
    void parsesFunctionHeaders() {
        assertThat(LineClassifier.matchFunctionHeader("def func(p1, p2=8):"))
                .contains(new FunctionHeader(0, "func", "p1, p2=8"));
        assertThat(LineClassifier.matchFunctionHeader("    def get_stats(self) -> Mapping[str, float]:"))
                .contains(new FunctionHeader(4, "get_stats", "self"));
        assertThat(LineClassifier.matchFunctionHeader("async def fetch(url):"))
                .contains(new FunctionHeader(0, "fetch", "url"));
        assertThat(LineClassifier.matchFunctionHeader("\tdef tabbed():"))
                .contains(new FunctionHeader(1, "tabbed", ""));
        assertThat(LineClassifier.matchFunctionHeader("    def __init__(self, a, b, c=[4, 5]): # Some comment."))
                .contains(new FunctionHeader(4, "__init__", "self, a, b, c=[4, 5]"));
    }

    @Test
    void rejectsNonFunctionHeaders() {
        assertThat(LineClassifier.matchFunctionHeader("def f(): return 1")).isEmpty();
        assertThat(LineClassifier.matchFunctionHeader("define = 5")).isEmpty();
        assertThat(LineClassifier.matchFunctionHeader("class A:")).isEmpty();
        assertThat(LineClassifier.matchFunctionHeader("def missing_colon(a)")).isEmpty();
    }

    @Test
    void parsesClassHeaders() {
        assertThat(LineClassifier.matchClassHeader("class Rect(Shape):"))
                .contains(new ClassHeader(0, "Rect", "Shape"));
        assertThat(LineClassifier.matchClassHeader("class Rect:"))
                .contains(new ClassHeader(0, "Rect", ""));
        assertThat(LineClassifier.matchClassHeader("    class Inner( A, B ):"))
                .contains(new ClassHeader(4, "Inner", "A, B"));
        assertThat(LineClassifier.matchClassHeader("class Class(object): # comment"))
                .contains(new ClassHeader(0, "Class", "object"));
    }

    @Test
    void rejectsNonClassHeaders() {
        assertThat(LineClassifier.matchClassHeader("classify = 1")).isEmpty();
        assertThat(LineClassifier.matchClassHeader("def f():")).isEmpty();
        assertThat(LineClassifier.matchClassHeader("class Broken(")).isEmpty();
    }

    @Test
    void classVariableShapeRequiresExactIndentation() {
        assertThat(LineClassifier.matchClassVariableShape("    W = 5", 4)).isTrue();
        assertThat(LineClassifier.matchClassVariableShape("W = 5", 0)).isTrue();
        assertThat(LineClassifier.matchClassVariableShape("        W = 5", 4)).isFalse();
        assertThat(LineClassifier.matchClassVariableShape("  W = 5", 4)).isFalse();
        assertThat(LineClassifier.matchClassVariableShape("    def f(self, a=1):", 4)).isFalse();
    }

    private static Line line(String text) {
        return new Line(1, text);
    }
}
