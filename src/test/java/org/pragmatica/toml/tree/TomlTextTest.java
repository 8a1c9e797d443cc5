package org.pragmatica.toml.tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class TomlTextTest {

    @Test
    void borrowed_readsThroughToSource() {
        var source = "key = 'value'";
        var text = TomlText.borrowed(source, Span.of(7, 12));

        assertTrue(text.isBorrowed());
        assertEquals(5, text.length());
        assertEquals('v', text.charAt(0));
        assertEquals("value", text.toString());
    }

    @Test
    void borrowed_subSequenceStaysBorrowed() {
        var text = TomlText.borrowed("abcdef", Span.of(1, 5));

        var sub = text.subSequence(1, 3);

        assertInstanceOf(TomlText.Borrowed.class, sub);
        assertEquals("cd", sub.toString());
    }

    @Test
    void variants_withSameContent_areEqual() {
        var borrowed = TomlText.borrowed("xhellox", Span.of(1, 6));
        var owned = TomlText.owned("hello");

        assertEquals(borrowed, owned);
        assertEquals(owned, borrowed);
        assertEquals(borrowed.hashCode(), owned.hashCode());
        assertEquals(TomlString.of("hello"), new TomlString(borrowed));
    }

    @Test
    void borrowed_outsideSource_throws() {
        assertThatThrownBy(() -> TomlText.borrowed("abc", Span.of(1, 4)))
            .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void borrowed_charAtOutsideView_throws() {
        var text = TomlText.borrowed("abcdef", Span.of(1, 3));

        assertThatThrownBy(() -> text.charAt(2))
            .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
