package org.pragmatica.smtfuzz.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreesTest {
    private static final Node ASSERTION = Node.apply("assert",
                                                     Node.apply("=", Node.apply("str.len", Node.symbol("x")), Node.integer(3)));
    private static final Node DECLARATION = Node.apply("declare-const", Node.symbol("x"), Node.symbol("String"));

    @Test
    void preOrder_visitsParentsBeforeChildren() {
        var entries = Trees.preOrder(List.of(DECLARATION, ASSERTION));

        assertThat(entries).extracting(entry -> entry.path().toString())
                           .containsExactly("0", "0/0", "0/1", "1", "1/0", "1/0/0", "1/0/0/0", "1/0/1");
        assertThat(entries.get(6).node()).isEqualTo(Node.symbol("x"));
    }

    @Test
    void get_followsPath() {
        var path = NodePath.top(1).child(0).child(1);

        assertThat(Trees.get(List.of(DECLARATION, ASSERTION), path)).isEqualTo(Node.integer(3));
    }

    @Test
    void get_invalidStep_throws() {
        assertThatThrownBy(() -> Trees.get(List.of(ASSERTION), NodePath.top(0).child(3)))
            .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void replace_buildsNewSequenceAndKeepsInput() {
        var nodes = List.of(DECLARATION, ASSERTION);

        var replaced = Trees.replace(nodes, NodePath.top(1).child(0).child(1), Node.integer(9));

        assertThat(replaced.get(0)).isSameAs(DECLARATION);
        assertThat(replaced.get(1).toString()).isEqualTo("(assert (= (str.len x) 9))");
        assertThat(nodes.get(1).toString()).isEqualTo("(assert (= (str.len x) 3))");
    }

    @Test
    void copy_producesEqualButDistinctNodes() {
        var copy = Trees.copy(ASSERTION);

        assertThat(copy).isEqualTo(ASSERTION)
                        .isNotSameAs(ASSERTION);
        assertThat(Trees.children(copy).get(0)).isNotSameAs(Trees.children(ASSERTION).get(0));
    }

    @Test
    void symbols_collectsNamesAndHeads() {
        assertThat(Trees.symbols(List.of(DECLARATION, ASSERTION)))
            .contains("declare-const", "x", "String", "assert", "=", "str.len");
    }

    @Test
    void children_ofSetting_isItsValue() {
        var setting = new Node.Setting("set-logic", java.util.Optional.empty(),
                                       java.util.Optional.of(Node.symbol("QF_S")));

        assertThat(Trees.children(setting)).containsExactly(Node.symbol("QF_S"));
        assertThat(Trees.withChildren(setting, List.of())).isEqualTo(
            new Node.Setting("set-logic", java.util.Optional.empty(), java.util.Optional.empty()));
    }

    @Test
    void expression_rejectsChildrenOnAtoms() {
        assertThatThrownBy(() -> new Node.Expression(ExpressionKind.SYMBOL, "x", List.of(Node.integer(1))))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Node.Expression(ExpressionKind.RE_RANGE, "re.range", List.of(Node.string("a"))))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
