package ai.pyscript.analyser.structure;

import static ai.pyscript.analyser.structure.StructureFixtures.lines;
import static ai.pyscript.analyser.structure.StructureFixtures.numbers;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import ai.pyscript.analyser.source.Line;
import java.util.List;
import org.junit.jupiter.api.Test;

class ClassDefinitionTest {

    private static final List<Line> NESTED = lines(
            "class Outer:",
            "    ",
            "    LIMIT: int = 10",
            "    class Inner(Base, metaclass=Meta):",
            "        KIND = \"inner\"",
            "        def run(self):",
            "            return self.KIND",
            "",
            "    def method(self, value=LIMIT):",
            "",
            "        local = value",
            "        return local");

    @Test
    void buildsClassWithVariableAndMethod() {
        List<Line> block = lines(
                "class Rect(Shape):",
                "    W = 5",
                "    def area(self):",
                "        return self.W");

        ClassDefinition type = ClassDefinition.fromBlock(block);

        assertThat(type.name()).isEqualTo("Rect");
        assertThat(type.parent()).isEqualTo("Shape");
        assertThat(type.variables()).containsExactly(new Assignment("W", "5", block.get(1)));
        assertThat(type.methods())
                .singleElement()
                .satisfies(method -> {
                    assertThat(method.name()).isEqualTo("area");
                    assertThat(method.parameters()).containsExactly("self");
                    assertThat(method.source()).containsExactly(block.get(2), block.get(3));
                });
        assertThat(type.classes()).isEmpty();
    }

    @Test
    void collectsNestedClassesAndStripsBlankLines() {
        ClassDefinition outer = ClassDefinition.fromBlock(NESTED);

        assertThat(outer.parent()).isEmpty();
        assertThat(outer.variables())
                .extracting(Assignment::name, Assignment::value)
                .containsExactly(tuple("LIMIT", "10"));
        assertThat(outer.methods())
                .singleElement()
                .satisfies(method -> {
                    assertThat(method.parameters()).containsExactly("self", "value=LIMIT");
                    assertThat(numbers(method.source())).containsExactly(9, 11, 12);
                });
        assertThat(outer.classes())
                .singleElement()
                .satisfies(inner -> {
                    assertThat(inner.name()).isEqualTo("Inner");
                    assertThat(inner.parent()).isEqualTo("Base, metaclass=Meta");
                    assertThat(inner.variables()).extracting(Assignment::name).containsExactly("KIND");
                    assertThat(inner.methods()).extracting(FunctionDefinition::name).containsExactly("run");
                });
    }

    @Test
    void methodAssignmentsAreNotClassVariables() {
        ClassDefinition type = ClassDefinition.fromBlock(lines(
                "class Counter:",
                "    count = 0",
                "    def bump(self):",
                "        self.count = self.count + 1",
                "        total = 2",
                "    step = 1"));

        assertThat(type.variables()).extracting(Assignment::name).containsExactly("count", "step");
    }

    @Test
    void skipsChainedAssignmentsAtMemberLevel() {
        ClassDefinition type = ClassDefinition.fromBlock(lines(
                "class Pair:",
                "    a = b = 1",
                "    c = 2"));

        assertThat(type.variables()).extracting(Assignment::name).containsExactly("c");
    }

    @Test
    void rebuildsSourceViewWithSyntheticHeader() {
        ClassDefinition outer = ClassDefinition.fromBlock(NESTED);

        List<Line> source = outer.source();

        assertThat(source.get(0)).isEqualTo(new Line(2, "class Outer:"));
        assertThat(numbers(source)).containsExactly(2, 3, 4, 5, 6, 7, 9, 11, 12);
        assertThat(source.get(2)).isEqualTo(new Line(4, "    class Inner(Base, metaclass=Meta):"));
    }

    @Test
    void sourceViewIsEmptyWithoutMembers() {
        ClassDefinition type = ClassDefinition.fromBlock(lines(
                "class Empty:",
                "    pass"));

        assertThat(type.name()).isEqualTo("Empty");
        assertThat(type.source()).isEmpty();
    }

    @Test
    void invalidHeaderKeepsMembersWithPlaceholderName() {
        ClassDefinition type = ClassDefinition.fromBlock(lines(
                "class Broken(",
                "    X = 1",
                "    def f(self):",
                "        pass"));

        assertThat(type.name()).isEmpty();
        assertThat(type.parent()).isEmpty();
        assertThat(type.variables()).extracting(Assignment::name).containsExactly("X");
        assertThat(type.methods()).extracting(FunctionDefinition::name).containsExactly("f");
    }

    @Test
    void headerOnlyBlockHasNoMembers() {
        ClassDefinition type = ClassDefinition.fromBlock(lines("class Bare:"));

        assertThat(type.name()).isEqualTo("Bare");
        assertThat(type.variables()).isEmpty();
        assertThat(type.methods()).isEmpty();
        assertThat(type.classes()).isEmpty();
    }

    @Test
    void buildingTwiceGivesEqualTrees() {
        assertThat(ClassDefinition.fromBlock(NESTED)).isEqualTo(ClassDefinition.fromBlock(NESTED));
    }
}
