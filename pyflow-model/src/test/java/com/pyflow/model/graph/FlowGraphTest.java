package com.pyflow.model.graph;

import com.pyflow.model.CyclicFlowException;
import com.pyflow.model.Dataset;
import com.pyflow.model.Flow;
import com.pyflow.model.Recipe;
import com.pyflow.model.RecipeType;
import com.pyflow.model.settings.CodeSettings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowGraphTest {

    private static Recipe code(String name, List<String> in, List<String> out) {
        return new Recipe(name, RecipeType.PYTHON, in, out, new CodeSettings("pass"));
    }

    private static Flow diamond() {
        Flow flow = new Flow("diamond");
        for (String d : List.of("a", "b", "c", "d")) flow.addDataset(Dataset.intermediate(d));
        flow.addRecipe(code("r1", List.of("a"), List.of("b")));
        flow.addRecipe(code("r2", List.of("a"), List.of("c")));
        flow.addRecipe(code("r3", List.of("b", "c"), List.of("d")));
        return flow;
    }

    @Test
    void topologicalSortCoversEveryNodeAndRespectsEdges() {
        Flow flow = diamond();
        List<String> order = flow.topologicalSort();
        assertEquals(flow.getDatasets().size() + flow.getRecipes().size(), order.size());
        for (Recipe r : flow.getRecipes()) {
            for (String in : r.getInputs()) assertTrue(order.indexOf(in) < order.indexOf(r.getName()));
            for (String out : r.getOutputs()) assertTrue(order.indexOf(r.getName()) < order.indexOf(out));
        }
        assertTrue(flow.detectCycles().isEmpty());
    }

    @Test
    void rootsAndLeaves() {
        FlowGraph g = diamond().graph();
        assertEquals(List.of("a"), g.roots().stream().map(FlowGraph.Node::name).toList());
        assertEquals(List.of("d"), g.leaves().stream().map(FlowGraph.Node::name).toList());
        assertEquals(7, g.nodeCount());
        assertEquals(7, g.edgeCount());
    }

    @Test
    void cycleIsDetectedAndSortFails() {
        Flow flow = new Flow("loop");
        flow.addDataset(Dataset.intermediate("x"));
        flow.addDataset(Dataset.intermediate("y"));
        flow.addRecipe(code("r1", List.of("x"), List.of("y")));
        flow.addRecipe(code("r2", List.of("y"), List.of("x")));

        List<List<String>> cycles = flow.detectCycles();
        assertEquals(1, cycles.size());
        List<String> cycle = cycles.get(0);
        assertEquals(cycle.get(0), cycle.get(cycle.size() - 1));
        assertTrue(cycle.containsAll(List.of("x", "r1", "y", "r2")));

        CyclicFlowException e = assertThrows(CyclicFlowException.class, flow::topologicalSort);
        assertFalse(e.getCycles().isEmpty());
    }

    @Test
    void missingDatasetReferencesAreIgnoredByTheGraph() {
        Flow flow = new Flow("partial");
        flow.addDataset(Dataset.intermediate("a"));
        flow.addRecipe(code("r1", List.of("a", "ghost"), List.of("a_out")));
        FlowGraph g = flow.graph();
        assertEquals(1, g.edgeCount());
    }

    @Test
    void diamondIsOneComponentAndStrayNodesAreSeparate() {
        Flow flow = diamond();
        flow.addDataset(Dataset.intermediate("lonely"));
        flow.addDataset(Dataset.intermediate("p"));
        flow.addDataset(Dataset.intermediate("q"));
        flow.addRecipe(code("r4", List.of("p"), List.of("q")));

        List<Set<FlowGraph.Node>> components = flow.graph().disconnectedSubgraphs();

        assertEquals(3, components.size());
        assertEquals(7, components.get(0).size());
        assertEquals(Set.of("lonely"), components.get(1).stream().map(FlowGraph.Node::name).collect(Collectors.toSet()));
        assertEquals(Set.of("p", "r4", "q"), components.get(2).stream().map(FlowGraph.Node::name).collect(Collectors.toSet()));
    }

    @Test
    void pathFollowsEdgeDirection() {
        FlowGraph g = diamond().graph();
        FlowGraph.Node a = new FlowGraph.Node("a", FlowGraph.NodeKind.DATASET);
        FlowGraph.Node d = new FlowGraph.Node("d", FlowGraph.NodeKind.DATASET);

        List<String> path = g.path(a, d);
        assertEquals(5, path.size());
        assertEquals("a", path.get(0));
        assertEquals("r3", path.get(3));
        assertEquals("d", path.get(4));
        assertEquals(List.of("a"), g.path(a, a));
        assertNull(g.path(d, a));
        assertNull(g.path(a, new FlowGraph.Node("zzz", FlowGraph.NodeKind.DATASET)));
    }
}
