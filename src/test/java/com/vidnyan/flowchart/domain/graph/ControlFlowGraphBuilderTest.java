package com.vidnyan.flowchart.domain.graph;

import com.vidnyan.flowchart.domain.graph.Edge.BranchLabel;
import com.vidnyan.flowchart.domain.source.FunctionLocator;
import com.vidnyan.flowchart.domain.source.SourceFunction;
import com.vidnyan.flowchart.domain.statement.StatementClassifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ControlFlowGraphBuilderTest {

    private final ControlFlowGraphBuilder builder = new ControlFlowGraphBuilder(StatementClassifier.defaults());
    private final FunctionLocator locator = new FunctionLocator();

    private FlowGraph build(String source) {
        SourceFunction function = locator.locate(source, "Foo");
        return builder.build(function);
    }

    private static List<String> edgeStrings(FlowGraph graph) {
        return graph.edges().stream()
                .map(e -> e.fromId() + (e.isLabeled() ? " -" + e.branchLabel().text() + "-> " : " -> ") + e.toId())
                .toList();
    }

    private static String label(FlowGraph graph, String id) {
        return graph.node(id).orElseThrow().label();
    }

    @Test
    void build_ShouldReconstructIfElseWithMessagingMacros() {
        String source = String.join("\n",
                "void Foo(void)",
                "{",
                "  RcvMESG(&l_A, B);",
                "  if (flag)",
                "  { RBMESG_SendMESG(C, D); }",
                "  else",
                "  { RBMICSYS_WritePort(E, F); }",
                "}");

        FlowGraph graph = build(source);

        assertEquals(List.of("start", "action1", "if2", "action3", "action4", "merge5", "end_node"),
                graph.nodes().stream().map(Node::id).toList());
        assertEquals("Receive the value from B and store it in l_A", label(graph, "action1"));
        assertEquals(NodeKind.DECISION, graph.node("if2").orElseThrow().kind());
        assertEquals("flag", label(graph, "if2"));
        assertEquals("Update the interface C with the value from D", label(graph, "action3"));
        assertEquals("Write to port", label(graph, "action4"));
        assertEquals(NodeKind.MERGE, graph.node("merge5").orElseThrow().kind());

        assertEquals(List.of(
                "start -> action1",
                "action1 -> if2",
                "if2 -Yes-> action3",
                "if2 -No-> action4",
                "action3 -> merge5",
                "action4 -> merge5",
                "merge5 -> end_node"), edgeStrings(graph));
        assertTrue(graph.isConnected());
    }

    @Test
    void build_ShouldCountOneDecisionAndMergePerIfElse() {
        String source = String.join("\n",
                "void Foo(void)",
                "{",
                "  if (a) { x = 1; } else { x = 2; }",
                "  y = x;",
                "  if (b)",
                "  {",
                "    z = 1;",
                "  }",
                "  else",
                "  {",
                "    z = 2;",
                "  }",
                "  if (c) { w = 1; } else { w = 2; }",
                "}");

        FlowGraph graph = build(source);

        assertEquals(3, graph.stats().decisionCount());
        assertEquals(3, graph.stats().mergeCount());
        assertEquals(7, graph.stats().actionCount());
        for (Node decision : graph.nodesOfKind(NodeKind.DECISION)) {
            List<Edge> out = graph.outgoing(decision.id());
            assertEquals(2, out.size());
            assertEquals(BranchLabel.YES, out.get(0).branchLabel());
            assertEquals(BranchLabel.NO, out.get(1).branchLabel());
        }
        assertTrue(graph.isConnected());
    }

    @Test
    void build_ShouldConnectEmptyBranchesDirectlyToMerge() {
        String source = String.join("\n",
                "void Foo(void)",
                "{",
                "  if (a)",
                "  {",
                "    /* nothing to do */",
                "  }",
                "  else",
                "  {",
                "    x = 1;",
                "  }",
                "  if (b)",
                "  {",
                "    y = 1;",
                "  }",
                "}");

        FlowGraph graph = build(source);

        assertEquals(List.of(
                "start -> if1",
                "if1 -No-> action2",
                "if1 -Yes-> merge3",
                "action2 -> merge3",
                "merge3 -> if4",
                "if4 -Yes-> action5",
                "action5 -> merge6",
                "if4 -No-> merge6",
                "merge6 -> end_node"), edgeStrings(graph));
        assertTrue(graph.isConnected());
    }

    @Test
    void build_ShouldAttachNestedIfToEnclosingBranch() {
        String source = String.join("\n",
                "void Foo(void)",
                "{",
                "  if (a)",
                "  {",
                "    if (b)",
                "    {",
                "      x = 1;",
                "    }",
                "    y = 2;",
                "  }",
                "  else",
                "  {",
                "    z = 3;",
                "  }",
                "}");

        FlowGraph graph = build(source);

        assertEquals(List.of(
                "start -> if1",
                "if1 -Yes-> if2",
                "if2 -Yes-> action3",
                "action3 -> merge4",
                "if2 -No-> merge4",
                "merge4 -> action5",
                "if1 -No-> action6",
                "action5 -> merge7",
                "action6 -> merge7",
                "merge7 -> end_node"), edgeStrings(graph));
        assertTrue(graph.isConnected());
    }

    @Test
    void build_ShouldTreatElseIfAsNestedDecisionOnNoBranch() {
        String source = String.join("\n",
                "void Foo(void)",
                "{",
                "  if (a) x = 1;",
                "  else if (b) x = 2;",
                "  else x = 3;",
                "}");

        FlowGraph graph = build(source);

        assertEquals(List.of(
                "start -> if1",
                "if1 -Yes-> action2",
                "if1 -No-> if3",
                "if3 -Yes-> action4",
                "if3 -No-> action5",
                "action4 -> merge6",
                "action5 -> merge6",
                "action2 -> merge7",
                "merge6 -> merge7",
                "merge7 -> end_node"), edgeStrings(graph));
    }

    @Test
    void build_ShouldLinearizeOtherBlocksAndIgnoreDirectives() {
        String source = String.join("\n",
                "void Foo(void)",
                "{",
                "  uint8 i;",
                "#ifdef MODE_A",
                "  for (i = 0; i < 4; i++)",
                "  {",
                "    x();",
                "  }",
                "#endif",
                "}");

        FlowGraph graph = build(source);

        assertEquals(List.of("uint8 i", "for (i = 0 i < 4 i++)", "x()"),
                graph.nodesOfKind(NodeKind.ACTION).stream().map(Node::label).toList());
        assertEquals(0, graph.stats().decisionCount());
        assertTrue(graph.isConnected());
    }

    @Test
    void build_ShouldUsePlaceholderForMalformedCondition() {
        FlowGraph graph = build("void Foo(void)\n{\n  if flag\n  {\n    x = 1;\n  }\n}");

        Node decision = graph.nodesOfKind(NodeKind.DECISION).get(0);
        assertEquals(BodyTokenizer.PLACEHOLDER_CONDITION, decision.label());
        assertTrue(graph.isConnected());
    }

    @Test
    void build_ShouldKeepStatementsAfterConditionWithUnclosedParenthesis() {
        String source = String.join("\n",
                "void Foo(void)",
                "{",
                "  if (a && (b)",
                "  { x = 1; }",
                "  y = 2;",
                "  RcvMESG(&A, B);",
                "}");

        FlowGraph graph = build(source);

        assertEquals(List.of("start", "if1", "action2", "merge3", "action4", "action5", "end_node"),
                graph.nodes().stream().map(Node::id).toList());
        assertEquals(BodyTokenizer.PLACEHOLDER_CONDITION, label(graph, "if1"));
        assertEquals("x = 1", label(graph, "action2"));
        assertEquals("y = 2", label(graph, "action4"));
        assertEquals("Receive the value from B and store it in A", label(graph, "action5"));
        assertTrue(graph.isConnected());
    }

    @Test
    void build_ShouldCloseUnbalancedParenthesisAtStatementEnd() {
        String source = String.join("\n",
                "void Foo(void)",
                "{",
                "  x = f(a;",
                "  y = 2;",
                "  z = 3;",
                "}");

        FlowGraph graph = build(source);

        assertEquals(List.of("x = f(a", "y = 2", "z = 3"),
                graph.nodesOfKind(NodeKind.ACTION).stream().map(Node::label).toList());
        assertTrue(graph.isConnected());
    }

    @Test
    void build_ShouldConnectEntryToExitForEmptyBody() {
        FlowGraph graph = build("void Foo(void)\n{\n  /* empty */\n}");

        assertEquals(List.of("start -> end_node"), edgeStrings(graph));
        assertTrue(graph.isConnected());
    }

    @Test
    void build_ShouldSurviveDanglingElse() {
        FlowGraph graph = build("void Foo(void)\n{\n  x = 1;\n  else\n  y = 2;\n}");

        assertEquals(List.of("start -> action1", "action1 -> action2", "action2 -> end_node"), edgeStrings(graph));
    }

    @Test
    void build_ShouldProduceConnectedGraphForDeeplyNestedBranches() {
        StringBuilder body = new StringBuilder("void Foo(void)\n{\n");
        for (int i = 0; i < 6; i++) {
            body.append("if (c").append(i).append(") {\n  a").append(i).append("();\n");
        }
        for (int i = 0; i < 6; i++) {
            body.append("} else {\n  b").append(i).append("();\n}\n");
        }
        body.append("}\n");

        FlowGraph graph = build(body.toString());

        assertEquals(6, graph.stats().decisionCount());
        assertEquals(6, graph.stats().mergeCount());
        assertTrue(graph.isConnected());
        for (Node node : graph.nodes()) {
            if (node.kind() != NodeKind.ENTRY) {
                assertFalse(graph.incoming(node.id()).isEmpty(), node.id());
            }
            if (node.kind() != NodeKind.EXIT) {
                assertFalse(graph.outgoing(node.id()).isEmpty(), node.id());
            }
        }
    }
}
