package com.vidnyan.flowchart.domain.graph;

import com.vidnyan.flowchart.domain.graph.BodyToken.Type;
import com.vidnyan.flowchart.domain.graph.Edge.BranchLabel;
import com.vidnyan.flowchart.domain.graph.GraphBuilder.Attachment;
import com.vidnyan.flowchart.domain.source.SourceFunction;
import com.vidnyan.flowchart.domain.statement.Statement;
import com.vidnyan.flowchart.domain.statement.StatementClassifier;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Builds the control-flow graph of one function by recursive descent over its body tokens.
 * <p>
 * Plain statements become a chain of action nodes. Each {@code if} becomes a decision node
 * whose Yes and No branches are parsed recursively and rejoined at a synthesized merge node;
 * an empty branch connects the decision straight to the merge with its branch label.
 * Braces that do not belong to an {@code if}/{@code else} only nest, they add no nodes.
 * <p>
 * Stateless; every call works on its own {@link GraphBuilder}.
 */
@Slf4j
public class ControlFlowGraphBuilder {

    private final StatementClassifier classifier;

    public ControlFlowGraphBuilder(StatementClassifier classifier) {
        this.classifier = classifier;
    }

    public FlowGraph build(SourceFunction function) {
        List<BodyToken> tokens = new BodyTokenizer().tokenize(function.rawText());
        Cursor cursor = new Cursor(tokens, function.startLine());
        GraphBuilder graph = new GraphBuilder();

        // signature tokens up to the body brace
        while (!cursor.atEnd() && !cursor.peek().is(Type.OPEN)) {
            cursor.next();
        }

        Attachment last = graph.entry();
        if (!cursor.atEnd()) {
            cursor.next();
            last = parseBlockBody(cursor, graph, last);
        } else {
            log.warn("{}: no body brace found, emitting empty flow", function.name());
        }

        FlowGraph result = graph.finish(last);
        log.debug("Built flow graph for {}: {}", function.name(), result.stats());
        return result;
    }

    /**
     * Parse statements until the brace closing the current block. The opening brace is
     * already consumed.
     */
    private Attachment parseBlockBody(Cursor cursor, GraphBuilder graph, Attachment attach) {
        while (!cursor.atEnd()) {
            if (cursor.peek().is(Type.CLOSE)) {
                cursor.next();
                return attach;
            }
            attach = parseUnit(cursor, graph, attach);
        }
        log.warn("Block left open at end of function, closing it");
        return attach;
    }

    /**
     * Parse one statement, block or if-construct.
     */
    private Attachment parseUnit(Cursor cursor, GraphBuilder graph, Attachment attach) {
        BodyToken token = cursor.next();
        return switch (token.type()) {
            case OPEN -> parseBlockBody(cursor, graph, attach);
            case IF -> parseIf(token, cursor, graph, attach);
            case STATEMENT -> parseStatement(token, cursor, graph, attach);
            case ELSE -> {
                log.warn("Line {}: 'else' without matching 'if', ignored", cursor.sourceLine(token));
                yield attach;
            }
            case CLOSE -> {
                log.warn("Line {}: unmatched closing brace, ignored", cursor.sourceLine(token));
                yield attach;
            }
        };
    }

    private Attachment parseStatement(BodyToken token, Cursor cursor, GraphBuilder graph, Attachment attach) {
        Statement statement = classifier.toStatement(token.text(), cursor.sourceLine(token));
        if (statement.isDropped()) {
            log.debug("Line {}: dropped '{}'", statement.lineNumber(), token.text());
            return attach;
        }
        Node action = graph.addAction(statement.label());
        graph.connect(attach, action);
        return Attachment.after(action);
    }

    private Attachment parseIf(BodyToken token, Cursor cursor, GraphBuilder graph, Attachment attach) {
        Node decision = graph.addDecision(StatementClassifier.stripComments(token.text()));
        graph.connect(attach, decision);

        Attachment yes = parseBranch(cursor, graph, Attachment.branch(decision, BranchLabel.YES));
        Attachment no = Attachment.branch(decision, BranchLabel.NO);
        if (!cursor.atEnd() && cursor.peek().is(Type.ELSE)) {
            cursor.next();
            no = parseBranch(cursor, graph, no);
        }

        Node merge = graph.addMerge();
        graph.connect(yes, merge);
        graph.connect(no, merge);
        return Attachment.after(merge);
    }

    /**
     * A branch body is a single unit: a braced block, a nested if, or one statement.
     * Nothing there (closing brace, else, end of text) means an empty branch.
     */
    private Attachment parseBranch(Cursor cursor, GraphBuilder graph, Attachment attach) {
        if (cursor.atEnd() || cursor.peek().is(Type.CLOSE) || cursor.peek().is(Type.ELSE)) {
            return attach;
        }
        return parseUnit(cursor, graph, attach);
    }

    private static final class Cursor {
        private final List<BodyToken> tokens;
        private final int lineOffset;
        private int position;

        Cursor(List<BodyToken> tokens, int startLine) {
            this.tokens = tokens;
            this.lineOffset = startLine - 1;
        }

        boolean atEnd() {
            return position >= tokens.size();
        }

        BodyToken peek() {
            return tokens.get(position);
        }

        BodyToken next() {
            return tokens.get(position++);
        }

        int sourceLine(BodyToken token) {
            return token.line() + lineOffset;
        }
    }
}
