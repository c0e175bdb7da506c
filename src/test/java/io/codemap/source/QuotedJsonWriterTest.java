package io.codemap.source;

import io.codemap.ast.RawNode;
import io.codemap.model.Position;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuotedJsonWriterTest {

    private final QuotedJsonWriter writer = new QuotedJsonWriter();
    private final QuotedJsonReader reader = new QuotedJsonReader();

    @Test
    void write_fixtureReadsBackUnchanged() throws Exception {
        RawNode tree;
        try (InputStream in = getClass().getResourceAsStream("/quoted/math.json")) {
            tree = reader.read(in);
        }

        assertThat(reader.read(writer.write(tree, 2))).isEqualTo(tree);
    }

    @Test
    void toJson_encodesAtomsFormsAndTuples() {
        RawNode.Form call = new RawNode.Form(RawNode.atom("foo"), new Position(3, 7), true,
                List.of(RawNode.variable("x"), new RawNode.Pair(RawNode.atom("ok"), RawNode.atom("nil"))));

        assertThat(writer.toJson(call).toString()).isEqualTo(
                "{\"form\":\"foo\",\"meta\":{\"line\":3,\"column\":7,\"no_parens\":true},"
                        + "\"args\":[{\"form\":\"x\",\"args\":null},{\"tuple\":[{\"atom\":\"ok\"},null]}]}");
        assertThat(writer.toJson(RawNode.atom("true")).toString()).isEqualTo("true");
        assertThat(writer.toJson(new RawNode.Literal(2)).toString()).isEqualTo("2");
    }

    @Test
    void write_indentsEachLevel() throws Exception {
        RawNode tree = RawNode.form("add", List.of(new RawNode.Literal(1L)));

        String json = writer.write(tree, 4);

        assertThat(json.lines()).contains("    \"form\" : \"add\",", "        1");
        assertThatThrownBy(() -> writer.write(tree, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
