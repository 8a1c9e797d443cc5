package org.pragmatica.toml.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.toml.error.ParseError;
import org.pragmatica.toml.error.ParseErrorKind;
import org.pragmatica.toml.error.TomlParseException;
import org.pragmatica.toml.tree.Span;
import org.pragmatica.toml.tree.TomlArray;
import org.pragmatica.toml.tree.TomlInteger;
import org.pragmatica.toml.tree.TomlString;
import org.pragmatica.toml.tree.TomlTable;
import org.pragmatica.toml.tree.ValueKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.junit.jupiter.api.Assertions.*;

class DocumentParserTest {

    @Test
    void parse_bareKeys_acceptDigitsDashesAndUnderscores() {
        var root = parse("""
            key = true
            bare_key = false
            bare-key = true
            1234 = true
            """);

        assertThat(root.keys()).containsExactly("key", "bare_key", "bare-key", "1234");
        assertTrue(root.getBoolean("1234").unwrap());
    }

    @Test
    void parse_quotedKeys_areDecoded() {
        var root = parse("""
            "127.0.0.1" = "value"
            "character encoding" = "value"
            'key2' = "value"
            'quoted "value"' = "value"
            "ʎǝʞ" = 1
            "tab\\there" = 2
            "" = "blank"
            """);

        assertThat(root.keys()).containsExactly("127.0.0.1", "character encoding", "key2", "quoted \"value\"", "ʎǝʞ",
                                                "tab\there", "");
        assertFalse(root.containsKey("127"));
    }

    @Test
    void parse_dottedKeysWithWhitespace_areSameAsWithout() {
        var root = parse("""
            name = "Orange"
            physical.color = "orange"
            physical . shape = "round"
            site."google.com" = true
            """);

        var physical = root.getTable("physical").unwrap();
        assertEquals("orange", physical.getString("color").unwrap());
        assertEquals("round", physical.getString("shape").unwrap());
        assertTrue(root.getTable("site").flatMap(site -> site.getBoolean("google.com")).unwrap());
    }

    @Test
    void parse_dottedKeysAcrossLines_extendSameTable() {
        var root = parse("""
            apple.type = "fruit"
            orange.type = "fruit"
            apple.skin = "thin"
            """);

        assertThat(root.getTable("apple").unwrap().keys()).containsExactly("type", "skin");
    }

    @Test
    void parse_headerWithSpacesAndQuotedSegment_navigatesPath() {
        var root = parse("[parent .  \"child.dotted\"]\nvalue = 1\n");

        var child = root.getTable("parent").flatMap(parent -> parent.getTable("child.dotted")).unwrap();
        assertEquals(1L, child.getInteger("value").unwrap());
    }

    @Test
    void parse_crlfLineEndings_areAccepted() {
        var root = parse("a = 1\r\n[t]\r\nb = \"x\"\r\n");

        assertEquals(1L, root.getInteger("a").unwrap());
        assertEquals("x", root.getTable("t").flatMap(t -> t.getString("b")).unwrap());
    }

    @Test
    void parse_multilineStrings_followLineRules() {
        var root = parse("""
            str1 = \"""
            Roses are red
            Violets are blue\"""
            str2 = '''
            The first newline is
            trimmed in raw strings.
               All other whitespace
               is preserved.
            '''
            str3 = \"""Here are two quotation marks: "". Simple enough.\"""
            str4 = \"""Here are fifteen quotation marks: ""\\\"""\\\"""\\\"""\\\"""\\".\"""
            str5 = ''''That,' she said, 'is still pointless.''''
            """);

        assertEquals("Roses are red\nViolets are blue", root.getString("str1").unwrap());
        assertEquals("The first newline is\ntrimmed in raw strings.\n   All other whitespace\n   is preserved.\n",
                     root.getString("str2").unwrap());
        assertEquals("Here are two quotation marks: \"\". Simple enough.", root.getString("str3").unwrap());
        assertEquals("Here are fifteen quotation marks: \"\"\"\"\"\"\"\"\"\"\"\"\"\"\".", root.getString("str4").unwrap());
        assertEquals("'That,' she said, 'is still pointless.'", root.getString("str5").unwrap());
    }

    @Test
    void parse_arrays_allowMixedKindsNewlinesAndTrailingComma() {
        var root = parse("""
            empty = []
            mixed = [ 0.1, 0.2, "three", true ]
            nested = [ [ 1, 2 ], ["a", "b", "c"] ]
            multiline = [
              1,   # one
              2,
              3,
            ]
            points = [ { x = 1, y = 2 }, { x = 7, y = 8 } ]
            """);

        assertTrue(root.getArray("empty").unwrap().isEmpty());
        assertThat(root.getArray("mixed").unwrap().values()).extracting(value -> value.kind())
                                                            .containsExactly(ValueKind.FLOAT, ValueKind.FLOAT,
                                                                             ValueKind.STRING, ValueKind.BOOLEAN);
        assertEquals(TomlArray.of(TomlInteger.of(1), TomlInteger.of(2)), root.getArray("nested").unwrap().get(0));
        assertEquals(3, root.getArray("multiline").unwrap().size());
        assertFalse(root.getArray("multiline").unwrap().isArrayOfTables());

        var second = root.getArray("points").unwrap().get(1).asTable().orElseThrow();
        assertEquals(8L, second.getInteger("y").unwrap());
    }

    @Test
    void parse_inlineTables_allowDottedKeysAndNesting() {
        var root = parse("""
            name = { first = "Tom", last = "Preston-Werner" }
            animal = { type.name = "pug" }
            empty = {}
            nested = { inner = { deep = 1 } }
            """);

        assertEquals("pug", root.getTable("animal")
                                .flatMap(animal -> animal.getTable("type"))
                                .flatMap(type -> type.getString("name"))
                                .unwrap());
        assertTrue(root.getTable("empty").unwrap().isEmpty());
        assertEquals(1L, root.getTable("nested")
                             .flatMap(nested -> nested.getTable("inner"))
                             .flatMap(inner -> inner.getInteger("deep"))
                             .unwrap());
    }

    @Test
    void parse_arrayOfTables_withSubtablesAndNestedArrays() {
        var root = parse("""
            [[fruits]]
            name = "apple"

            [fruits.physical]
            color = "red"

            [[fruits.varieties]]
            name = "red delicious"

            [[fruits.varieties]]
            name = "granny smith"

            [[fruits]]
            name = "banana"

            [[fruits.varieties]]
            name = "plantain"
            """);

        var fruits = root.getArray("fruits").unwrap();
        assertEquals(2, fruits.size());

        var apple = fruits.get(0).asTable().orElseThrow();
        assertEquals("red", apple.getTable("physical").flatMap(p -> p.getString("color")).unwrap());
        assertEquals(2, apple.getArray("varieties").unwrap().size());

        var banana = fruits.get(1).asTable().orElseThrow();
        assertEquals(1, banana.getArray("varieties").unwrap().size());
    }

    @Test
    void parse_dottedKeyAfterArrayHeader_goesIntoLastElement() {
        var root = parse("""
            [[products]]
            name = "Hammer"
            details.sku = 738594937

            [[products]]
            name = "Nail"
            details.sku = 284758393
            """);

        var nail = root.getArray("products").unwrap().get(1).asTable().orElseThrow();
        assertEquals(284758393L, nail.getTable("details").flatMap(d -> d.getInteger("sku")).unwrap());
    }

    @Test
    void parse_superTableAfterSubTable_isAllowedOnce() {
        var root = parse("""
            [x.y.z.w]
            a = 1
            [x]
            b = 2
            """);

        assertEquals(2L, root.getTable("x").flatMap(x -> x.getInteger("b")).unwrap());

        var error = failure("[x.y]\n[x]\n[x]\n");
        assertEquals(ParseErrorKind.DUPLICATE_KEY, error.kind());
        assertEquals(Span.of(11, 12), error.span());
    }

    @Test
    void parse_redefinedTable_fails() {
        var error = failure("[fruit]\napple = \"red\"\n\n[fruit]\norange = \"orange\"\n");

        assertEquals(ParseErrorKind.DUPLICATE_KEY, error.kind());
        assertEquals(Span.of(24, 29), error.span());
    }

    @Test
    void parse_headerOverDottedTable_fails() {
        var error = failure("[fruit]\napple.color = \"red\"\n[fruit.apple]\n");

        assertEquals(ParseErrorKind.DUPLICATE_KEY, error.kind());
    }

    @Test
    void parse_dottedKeyIntoHeaderTableFromAnotherSection_fails() {
        var error = failure("[a.b]\nc = 1\n[a]\nb.d = 2\n");

        assertEquals(ParseErrorKind.DUPLICATE_KEY, error.kind());
    }

    @Test
    void parse_extendingInlineTable_fails() {
        assertEquals(ParseErrorKind.DUPLICATE_KEY, failure("point = { x = 1 }\npoint.y = 2\n").kind());
        assertEquals(ParseErrorKind.DUPLICATE_KEY, failure("point = { x = 1 }\n[point]\ny = 2\n").kind());
    }

    @Test
    void parse_arrayHeaderOverStaticArray_fails() {
        var error = failure("fruits = []\n[[fruits]]\n");

        assertEquals(ParseErrorKind.DUPLICATE_KEY, error.kind());
        assertEquals(Span.of(14, 20), error.span());
    }

    @Test
    void parse_tableHeaderOverArrayOfTables_fails() {
        assertEquals(ParseErrorKind.DUPLICATE_KEY, failure("[[a]]\n[a]\n").kind());
    }

    @Test
    void parse_dottedKeyThroughScalar_fails() {
        var error = failure("a = 1\na.b = 2\n");

        assertEquals(ParseErrorKind.DUPLICATE_KEY, error.kind());
        assertEquals(Span.of(6, 7), error.span());
    }

    @Test
    void parse_missingEquals_reportsTerminator() {
        var error = failure("key \"value\"\n");

        assertEquals(ParseErrorKind.EXPECTED_EQUALS, error.kind());
        assertEquals(Span.of(4, 11), error.span());
    }

    @Test
    void parse_keyAtEndOfInput_reportsEndOfInput() {
        var error = failure("key");

        assertEquals(ParseErrorKind.UNEXPECTED_END_OF_INPUT, error.kind());
        assertEquals(Span.at(3), error.span());
    }

    @Test
    void parse_missingValue_reportsNewline() {
        var error = failure("key = \n");

        assertEquals(ParseErrorKind.EXPECTED_VALUE, error.kind());
        assertEquals(Span.of(6, 7), error.span());
    }

    @Test
    void parse_twoPairsOnOneLine_fails() {
        var error = failure("first = \"Tom\" last = \"Preston-Werner\"\n");

        assertEquals(ParseErrorKind.EXPECTED_NEWLINE, error.kind());
        assertEquals(Span.of(14, 18), error.span());
    }

    @Test
    void parse_unterminatedArray_reportsEndOfInput() {
        var error = failure("a = [1, 2");

        assertEquals(ParseErrorKind.UNCLOSED_BRACKET, error.kind());
        assertEquals(Span.at(9), error.span());
    }

    @Test
    void parse_arrayWithoutComma_fails() {
        var error = failure("a = [1 2]");

        assertEquals(ParseErrorKind.MISSING_COMMA, error.kind());
        assertEquals(Span.of(7, 8), error.span());
    }

    @Test
    void parse_inlineTableAcrossLines_fails() {
        var error = failure("a = { b = 1,\n c = 2 }");

        assertEquals(ParseErrorKind.UNCLOSED_BRACKET, error.kind());
        assertEquals(Span.of(12, 13), error.span());
    }

    @Test
    void parse_inlineTableTrailingComma_fails() {
        var error = failure("a = { b = 1, }");

        assertEquals(ParseErrorKind.EXPECTED_KEY, error.kind());
        assertEquals(Span.of(13, 14), error.span());
    }

    @Test
    void parse_inlineTableDuplicateKey_fails() {
        var error = failure("a = { b = 1, b = 2 }");

        assertEquals(ParseErrorKind.DUPLICATE_KEY, error.kind());
        assertEquals(Span.of(13, 14), error.span());
    }

    @Test
    void parse_unclosedHeader_fails() {
        assertEquals(ParseErrorKind.UNCLOSED_BRACKET, failure("[a b]\n").kind());
        assertEquals(ParseErrorKind.UNEXPECTED_END_OF_INPUT, failure("[a").kind());
        assertEquals(ParseErrorKind.UNCLOSED_BRACKET, failure("[[a]\n").kind());
        assertEquals(ParseErrorKind.UNCLOSED_BRACKET, failure("[[a] ]\n").kind());
    }

    @Test
    void parse_emptyHeader_failsWithExpectedKey() {
        var error = failure("[]\n");

        assertEquals(ParseErrorKind.EXPECTED_KEY, error.kind());
        assertEquals(Span.of(1, 2), error.span());
    }

    @Test
    void parse_multilineStringAsKey_fails() {
        assertEquals(ParseErrorKind.EXPECTED_KEY, failure("\"\"\"key\"\"\" = 1\n").kind());
    }

    @Test
    void parse_stringsAndDateTimes_borrowFromSource() {
        var source = "s = 'x'\nd = 2024-01-15\n";
        var root = DocumentParser.parse(source, ParserConfig.DEFAULT);

        assertTrue(((TomlString) root.get("s").orElseThrow()).isBorrowed());
        var date = root.getDateTime("d").unwrap();
        assertEquals(ValueKind.LOCAL_DATE, date.kind());
        assertTrue(date.text().isBorrowed());
    }

    private static TomlTable parse(String source) {
        return DocumentParser.parse(source, ParserConfig.DEFAULT);
    }

    private static ParseError failure(String source) {
        return catchThrowableOfType(() -> parse(source), TomlParseException.class).error();
    }
}
