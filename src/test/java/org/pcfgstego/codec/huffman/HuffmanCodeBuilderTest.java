package org.pcfgstego.codec.huffman;

import org.pcfgstego.grammar.Alternative;
import org.pcfgstego.grammar.Grammar;
import org.pcfgstego.grammar.GrammarParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class HuffmanCodeBuilderTest {

    private HuffmanCodeBuilder builder;

    @BeforeEach
    void setUp() throws Exception {
        builder = new HuffmanCodeBuilder(GrammarParser.strict().parse(readStoryGrammar()));
    }

    static String readStoryGrammar() throws IOException {
        try (InputStream in = HuffmanCodeBuilderTest.class.getResourceAsStream("/grammars/story.grammar")) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void equalWeightsFollowDeclarationOrder() throws Exception {
        Grammar grammar = GrammarParser.strict().parse(String.join("\n",
                "Start -> Greeting CITY .",
                "CITY -> \"Boston\" [0.5] | \"Denver\" [0.5]"));

        CodeTable table = new HuffmanCodeBuilder(grammar).codeTable("CITY");

        assertThat(table.asMap()).containsExactly(Map.entry("\"Boston\"", "0"), Map.entry("\"Denver\"", "1"));
    }

    @Test
    void buildsExpectedCodewords() {
        assertThat(builder.codeTable("SUBJECT").asMap()).containsExactly(
                Map.entry("\"the fox\"", "0"),
                Map.entry("\"a baker\"", "11"),
                Map.entry("\"my uncle\"", "10"));
        assertThat(builder.codeTable("VERB").asMap()).containsExactly(
                Map.entry("found", "0"),
                Map.entry("painted", "10"),
                Map.entry("sold", "111"),
                Map.entry("buried", "110"));
        assertThat(builder.codeTable("PLACE").asMap()).containsExactly(
                Map.entry("\"in Boston\"", "0"),
                Map.entry("\"near Denver\"", "10"),
                Map.entry("\"by the river\"", "11"));
    }

    @Test
    void singleAlternativeGetsEmptyCodeword() {
        CodeTable table = builder.codeTable("Opening");

        assertThat(table.size()).isEqualTo(1);
        assertThat(table.codeword(0)).isEmpty();
    }

    @Test
    void expectedLengthIsOptimal() {
        // lengths 1, 2, 3, 3 for weights .4 .3 .2 .1
        assertThat(builder.codeTable("VERB").expectedLength()).isCloseTo(1.9, within(1e-9));
    }

    @Test
    void lookupsWorkInBothDirections() {
        CodeTable table = builder.codeTable("OBJECT");

        assertThat(table.codewordFor("\"the violin\"")).contains("0");
        assertThat(table.alternativeFor("1")).map(Alternative::surfaceText).contains("a lantern");
        assertThat(table.alternativeFor("01")).isEmpty();
        assertThat(table.codewordFor("\"a trumpet\"")).isEmpty();
    }

    @Test
    void tablesAreCachedPerSymbol() {
        CodeTable first = builder.codeTable("VERB");
        CodeTable second = builder.codeTable("VERB");

        assertThat(second).isSameAs(first);
        assertThat(builder.cachedTableCount()).isEqualTo(1);
    }

    @Test
    void codeTablesSkipExcludedAndDeterministicSymbols() {
        Map<String, CodeTable> tables = builder.codeTables(Set.of("Start", "static"));

        assertThat(tables).containsOnlyKeys("SUBJECT", "VERB", "OBJECT", "PLACE");
        assertThat(tables.keySet()).containsExactly("SUBJECT", "VERB", "OBJECT", "PLACE");
    }

    @Test
    void unknownSymbolIsRejected() {
        assertThatThrownBy(() -> builder.codeTable("ADJECTIVE")).isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 5, 8, 13, 40})
    void codesArePrefixFreeAndComplete(int size) {
        List<Alternative> alternatives = new ArrayList<>();
        double total = 0.0;
        for (int i = 0; i < size; i++) {
            total += (i % 4) + 1;
        }
        for (int i = 0; i < size; i++) {
            alternatives.add(new Alternative("w" + i, List.of("w" + i), ((i % 4) + 1) / total));
        }

        CodeTable table = HuffmanCodeBuilder.build("X", alternatives);

        assertThat(table.size()).isEqualTo(size);
        double kraft = 0.0;
        for (int i = 0; i < size; i++) {
            String a = table.codeword(i);
            assertThat(a).isNotEmpty().matches("[01]+");
            kraft += Math.pow(2, -a.length());
            for (int j = 0; j < size; j++) {
                if (i != j) {
                    assertThat(table.codeword(j)).doesNotStartWith(a);
                }
            }
        }
        assertThat(kraft).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void rebuildingGivesIdenticalTables() {
        List<Alternative> alternatives = builder.grammar().alternatives("PLACE");

        assertThat(HuffmanCodeBuilder.build("PLACE", alternatives))
                .isEqualTo(HuffmanCodeBuilder.build("PLACE", alternatives));
    }
}
