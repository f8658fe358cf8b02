package org.pcfgstego.codec.huffman;

import org.pcfgstego.grammar.Alternative;
import org.pcfgstego.grammar.Grammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds and caches one minimum-redundancy prefix code per grammar symbol.
 * <p>
 * The construction repeatedly merges the two lowest-weight pending nodes. The node popped first gets
 * {@code '0'} prepended to its codewords, the second {@code '1'}. Weight ties are broken by creation
 * order: leaves in declaration order, then merged nodes in the order they were created. The result
 * is therefore identical on every run for the same grammar.
 * <p>
 * Tables are built lazily and never invalidated, so one builder can be shared by an encoder and a
 * detector over the same immutable grammar.
 */
public final class HuffmanCodeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(HuffmanCodeBuilder.class);

    private static final Comparator<Node> ORDER = Comparator
            .comparingDouble(Node::weight)
            .thenComparingInt(Node::sequence);

    private final Grammar grammar;
    private final Map<String, CodeTable> cache = new ConcurrentHashMap<>();

    public HuffmanCodeBuilder(Grammar grammar) {
        this.grammar = grammar;
    }

    public Grammar grammar() {
        return grammar;
    }

    /**
     * Returns the code table of a symbol, building it on first use.
     *
     * @param symbol A symbol with a rule in the grammar.
     * @return The cached code table.
     * @throws IllegalArgumentException if the grammar has no rule for the symbol.
     */
    public CodeTable codeTable(String symbol) {
        CodeTable cached = cache.get(symbol);
        if (cached != null) {
            return cached;
        }
        return cache.computeIfAbsent(symbol, s -> build(s, grammar.alternatives(s)));
    }

    /**
     * Builds the tables of every symbol with at least two alternatives, skipping the excluded ones.
     *
     * @param excluded Symbols that never carry payload.
     * @return Symbol to table, in grammar declaration order.
     */
    public Map<String, CodeTable> codeTables(Collection<String> excluded) {
        Map<String, CodeTable> tables = new LinkedHashMap<>();
        for (String symbol : grammar.symbols()) {
            if (!excluded.contains(symbol) && !grammar.isDeterministic(symbol)) {
                tables.put(symbol, codeTable(symbol));
            }
        }
        return tables;
    }

    /**
     * @return The number of tables built so far.
     */
    public int cachedTableCount() {
        return cache.size();
    }

    static CodeTable build(String symbol, List<Alternative> alternatives) {
        int n = alternatives.size();
        List<String> codewords = new ArrayList<>(n);
        if (n == 1) {
            codewords.add("");
            return new CodeTable(symbol, alternatives, codewords);
        }

        StringBuilder[] codes = new StringBuilder[n];
        PriorityQueue<Node> queue = new PriorityQueue<>(ORDER);
        for (int i = 0; i < n; i++) {
            codes[i] = new StringBuilder();
            queue.add(new Node(alternatives.get(i).weight(), i, List.of(i)));
        }

        int sequence = n;
        while (queue.size() > 1) {
            Node first = queue.poll();
            Node second = queue.poll();
            for (int leaf : first.leaves()) codes[leaf].insert(0, '0');
            for (int leaf : second.leaves()) codes[leaf].insert(0, '1');
            List<Integer> merged = new ArrayList<>(first.leaves().size() + second.leaves().size());
            merged.addAll(first.leaves());
            merged.addAll(second.leaves());
            queue.add(new Node(first.weight() + second.weight(), sequence++, merged));
        }

        for (StringBuilder code : codes) {
            codewords.add(code.toString());
        }
        CodeTable table = new CodeTable(symbol, alternatives, codewords);
        LOG.debug("Built code table {}", table);
        return table;
    }

    private record Node(double weight, int sequence, List<Integer> leaves) {}
}
