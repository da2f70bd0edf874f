package com.raditha.unnest.analysis;

import com.raditha.unnest.adapter.JavaTreeAdapter;
import com.raditha.unnest.adapter.MalformedStructureException;
import com.raditha.unnest.analysis.ScopeAnalyzer.VariableInfo;
import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.BlockKind;
import com.raditha.unnest.model.Dialect;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScopeAnalyzerTest {

    @Test
    void testTypedDeclarations() {
        ScopeAnalyzer scope = new ScopeAnalyzer(Dialect.JAVA);

        List<VariableInfo> single = scope.declarations("int count = items.size();");
        assertEquals(1, single.size());
        assertEquals("count", single.get(0).name());
        assertEquals("int", single.get(0).type());

        List<VariableInfo> generic = scope.declarations("Map<String, List<Integer>> index = new HashMap<>();");
        assertEquals("index", generic.get(0).name());
        assertEquals("Map<String, List<Integer>>", generic.get(0).type());

        assertEquals(List.of("a", "b"), scope.declarations("String a = x, b = y;").stream().map(VariableInfo::name).toList());
        assertTrue(scope.declarations("x = 5;").isEmpty());
        assertTrue(scope.declarations("return x;").isEmpty());
        assertTrue(scope.declarations("run(a, b);").isEmpty());
    }

    @Test
    void testScriptAndPythonDeclarations() {
        assertEquals(List.of("total", "count"), new ScopeAnalyzer(Dialect.JAVASCRIPT)
                .declarations("const total = 0, count = 1").stream().map(VariableInfo::name).toList());
        assertEquals(List.of("x"), new ScopeAnalyzer(Dialect.PYTHON)
                .declarations("x = compute()").stream().map(VariableInfo::name).toList());
        assertTrue(new ScopeAnalyzer(Dialect.PYTHON).declarations("self.x = 1").isEmpty());
    }

    @Test
    void testLoopDeclarations() {
        List<VariableInfo> vars = new ScopeAnalyzer(Dialect.JAVA).loopDeclarations("for (int i = 0; i < n; i++)");
        assertEquals(1, vars.size());
        assertEquals("i", vars.get(0).name());
        assertEquals("int", vars.get(0).type());
    }

    @Test
    void testNamesReadAndAssigned() {
        ScopeAnalyzer scope = new ScopeAnalyzer(Dialect.JAVA);

        assertEquals(Set.of("a", "c", "d"), scope.namesRead("a.b(c) + d"));
        assertEquals(Set.of("x", "y", "z", "w"), scope.assignedNames("x = 1; y += 2; z++; ++w; o.p = 3;"));
    }

    @Test
    void testAvailableVariablesAtRegionStart() throws MalformedStructureException {
        String code = """
                class A {
                    void f(String name, int limit) {
                        int seen = 0;
                        if (limit > 0) {
                            System.out.println(name + seen);
                        }
                        int later = 1;
                    }
                }
                """;
        Block root = new JavaTreeAdapter().index(code);
        BlockIndex index = new BlockIndex(root);
        Block function = root.walk().filter(b -> b.kind() == BlockKind.FUNCTION).findFirst().orElseThrow();
        Block region = root.walk().filter(Block::isConditional).findFirst().orElseThrow();
        ScopeAnalyzer scope = new ScopeAnalyzer(Dialect.JAVA);

        List<VariableInfo> available = scope.getAvailableVariables(function, region, index);
        assertEquals(List.of("name", "limit", "seen"), available.stream().map(VariableInfo::name).toList());
        assertTrue(available.get(0).isParameter());
        assertTrue(available.get(2).isLocal());

        List<VariableInfo> used = scope.referencedVariables(available, "System.out.println(name + seen);");
        assertEquals(List.of("name", "seen"), used.stream().map(VariableInfo::name).toList());
    }
}
