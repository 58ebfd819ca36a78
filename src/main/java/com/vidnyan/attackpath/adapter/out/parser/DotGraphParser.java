package com.vidnyan.attackpath.adapter.out.parser;

import com.vidnyan.attackpath.application.port.out.GraphDescriptionParser;
import com.vidnyan.attackpath.domain.graph.GraphModel;
import com.vidnyan.attackpath.domain.graph.MalformedGraphException;
import com.vidnyan.attackpath.domain.graph.NodeKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Recursive-descent parser for the structural subset of DOT used by interaction graphs.
 *
 * Node statements carry id, kind hints (shape, label, id prefix) and weights; edge
 * statements carry endpoints and {@code cost} / {@code stealth}. Everything else is
 * styling: it is kept verbatim on the model for re-rendering and otherwise ignored.
 * {@code node [...]} and {@code edge [...]} defaults apply to later statements of the
 * same block; subgraphs are flattened.
 */
@Slf4j
@Component
public class DotGraphParser implements GraphDescriptionParser {

    static final String COST_KEY = "cost";
    static final String STEALTH_KEY = "stealth";

    @Override
    public GraphModel parse(String description, ParsingOptions options) {
        Instant start = Instant.now();
        List<DotToken> tokens = DotTokenizer.tokenize(description);

        GraphModel.Builder builder = GraphModel.builder().weightProfile(options.weightProfile());
        new Session(tokens, builder, options.weightKeys()).parseGraph();
        GraphModel graph = builder.build();

        GraphModel.Stats stats = graph.stats();
        log.info("Parsed graph: {} nodes, {} edges, {} gates in {}ms",
                stats.nodeCount(), stats.edgeCount(), stats.gateCount(),
                Duration.between(start, Instant.now()).toMillis());
        return graph;
    }

    /**
     * Parsing state for one description.
     */
    private static final class Session {

        private final List<DotToken> tokens;
        private final GraphModel.Builder builder;
        private final Set<String> weightKeys;
        private int pos;

        private Session(List<DotToken> tokens, GraphModel.Builder builder, Set<String> weightKeys) {
            this.tokens = tokens;
            this.builder = builder;
            this.weightKeys = weightKeys;
        }

        void parseGraph() {
            if (peek().isKeyword("strict")) {
                advance();
            }
            if (peek().isKeyword("graph")) {
                throw error("Undirected graphs are not supported, expected 'digraph'", peek());
            }
            if (!peek().isKeyword("digraph")) {
                throw error("Expected 'digraph' but found " + peek().describe(), peek());
            }
            advance();
            if (peek().is(DotToken.Type.ID)) {
                advance(); // graph name
            }
            expect(DotToken.Type.LBRACE);
            parseStatements(new Scope());
            expect(DotToken.Type.RBRACE);
            if (!peek().is(DotToken.Type.EOF)) {
                throw error("Unexpected " + peek().describe() + " after the closing brace", peek());
            }
        }

        private void parseStatements(Scope scope) {
            while (!peek().is(DotToken.Type.RBRACE)) {
                if (peek().is(DotToken.Type.EOF)) {
                    throw error("Missing closing '}'", peek());
                }
                parseStatement(scope);
                if (peek().is(DotToken.Type.SEMICOLON)) {
                    advance();
                }
            }
        }

        private void parseStatement(Scope scope) {
            DotToken token = peek();

            if (token.is(DotToken.Type.LBRACE) || token.isKeyword("subgraph")) {
                parseSubgraph(scope);
                if (peek().is(DotToken.Type.ARROW)) {
                    throw error("Subgraphs as edge endpoints are not supported", peek());
                }
                return;
            }

            if ((token.isKeyword("graph") || token.isKeyword("node") || token.isKeyword("edge"))
                    && peekAt(1).is(DotToken.Type.LBRACKET)) {
                advance();
                Map<String, String> defaults = parseAttributeLists();
                if (token.isKeyword("node")) {
                    scope.nodeDefaults.putAll(defaults);
                } else if (token.isKeyword("edge")) {
                    scope.edgeDefaults.putAll(defaults);
                }
                return;
            }

            if (!token.is(DotToken.Type.ID)) {
                throw error("Unexpected " + token.describe(), token);
            }
            String id = advance().text();

            if (peek().is(DotToken.Type.EQUALS)) {
                advance();
                expectId(); // graph attribute, styling only
                return;
            }

            skipPort();
            if (peek().is(DotToken.Type.ARROW) || peek().is(DotToken.Type.UNDIRECTED_EDGE)) {
                parseEdgeChain(id, token.line(), scope);
            } else {
                parseNode(id, token.line(), scope);
            }
        }

        private void parseSubgraph(Scope parent) {
            if (peek().isKeyword("subgraph")) {
                advance();
                if (peek().is(DotToken.Type.ID)) {
                    advance();
                }
            }
            expect(DotToken.Type.LBRACE);
            parseStatements(parent.child());
            expect(DotToken.Type.RBRACE);
        }

        private void parseNode(String id, int line, Scope scope) {
            Map<String, String> attributes = new LinkedHashMap<>(scope.nodeDefaults);
            attributes.putAll(parseAttributeLists());

            NodeKind kind = NodeKindResolver.resolve(id, attributes, line).orElse(null);
            Map<String, Double> weights = new LinkedHashMap<>();
            for (String key : weightKeys) {
                Double value = number(attributes, key, id, line);
                if (value != null) {
                    weights.put(key, value);
                }
            }
            builder.node(id, kind, weights, attributes, line);
        }

        private void parseEdgeChain(String first, int line, Scope scope) {
            List<String> endpoints = new ArrayList<>();
            endpoints.add(first);
            while (peek().is(DotToken.Type.ARROW) || peek().is(DotToken.Type.UNDIRECTED_EDGE)) {
                if (peek().is(DotToken.Type.UNDIRECTED_EDGE)) {
                    throw error("Undirected edge '--' in a digraph", peek());
                }
                advance();
                if (peek().is(DotToken.Type.LBRACE) || peek().isKeyword("subgraph")) {
                    throw error("Subgraphs as edge endpoints are not supported", peek());
                }
                endpoints.add(expectId().text());
                skipPort();
            }

            Map<String, String> attributes = new LinkedHashMap<>(scope.edgeDefaults);
            attributes.putAll(parseAttributeLists());
            String label = first + " -> " + endpoints.get(1);
            Double cost = number(attributes, COST_KEY, label, line);
            Double stealth = number(attributes, STEALTH_KEY, label, line);

            for (int i = 0; i + 1 < endpoints.size(); i++) {
                builder.edge(endpoints.get(i), endpoints.get(i + 1), cost, stealth, attributes, line);
            }
        }

        private Map<String, String> parseAttributeLists() {
            Map<String, String> attributes = new LinkedHashMap<>();
            while (peek().is(DotToken.Type.LBRACKET)) {
                advance();
                while (!peek().is(DotToken.Type.RBRACKET)) {
                    String key = expectId().text();
                    String value = "true";
                    if (peek().is(DotToken.Type.EQUALS)) {
                        advance();
                        value = expectId().text();
                    }
                    attributes.put(key, value);
                    if (peek().is(DotToken.Type.COMMA) || peek().is(DotToken.Type.SEMICOLON)) {
                        advance();
                    }
                }
                expect(DotToken.Type.RBRACKET);
            }
            return attributes;
        }

        private void skipPort() {
            if (peek().is(DotToken.Type.COLON)) {
                advance();
                expectId();
                if (peek().is(DotToken.Type.COLON)) {
                    advance();
                    expectId();
                }
            }
        }

        private static Double number(Map<String, String> attributes, String key, String owner, int line) {
            String raw = attributes.get(key);
            if (raw == null) {
                return null;
            }
            try {
                double value = Double.parseDouble(raw.trim());
                if (Double.isFinite(value)) {
                    return value;
                }
            } catch (NumberFormatException e) {
                // reported below
            }
            throw new MalformedGraphException(String.format(
                    "Attribute '%s' of %s must be a finite number, got '%s'", key, owner, raw), line);
        }

        private DotToken peek() {
            return tokens.get(pos);
        }

        private DotToken peekAt(int offset) {
            return tokens.get(Math.min(pos + offset, tokens.size() - 1));
        }

        private DotToken advance() {
            DotToken token = tokens.get(pos);
            if (!token.is(DotToken.Type.EOF)) {
                pos++;
            }
            return token;
        }

        private DotToken expect(DotToken.Type type) {
            DotToken token = peek();
            if (!token.is(type)) {
                throw error("Expected " + type + " but found " + token.describe(), token);
            }
            return advance();
        }

        private DotToken expectId() {
            return expect(DotToken.Type.ID);
        }

        private static MalformedGraphException error(String message, DotToken at) {
            return new MalformedGraphException(message, at.line());
        }
    }

    /**
     * Attribute defaults of one block; nested blocks start from a copy of their parent's.
     */
    private static final class Scope {
        private final Map<String, String> nodeDefaults = new LinkedHashMap<>();
        private final Map<String, String> edgeDefaults = new LinkedHashMap<>();

        private Scope child() {
            Scope child = new Scope();
            child.nodeDefaults.putAll(nodeDefaults);
            child.edgeDefaults.putAll(edgeDefaults);
            return child;
        }
    }
}
