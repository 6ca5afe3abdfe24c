package org.patternlab.structural.decorator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Text decorator Tests")
class TextDecoratorTest {

    @Test
    @DisplayName("Decorators compose in wrapping order")
    void testComposition() {
        TextPublisher message = new SimpleText("Hello world");
        TextPublisher html = new HtmlDecorator(message);
        TextPublisher upper = new UpperCaseDecorator(html);

        assertEquals("Hello world", message.publish());
        assertEquals("<html>Hello world</html>", html.publish());
        assertEquals("<HTML>HELLO WORLD</HTML>", upper.publish());
        assertEquals("<html>HELLO WORLD</html>", new HtmlDecorator(new UpperCaseDecorator(message)).publish());
    }

    @Test
    @DisplayName("Base decorator delegates unchanged")
    void testBaseDelegation() {
        TextDecorator passThrough = new TextDecorator(new SimpleText("plain")) {
        };
        assertEquals("plain", passThrough.publish());
    }

    @Test
    @DisplayName("Null component and null text are rejected")
    void testNullRejected() {
        assertThrows(NullPointerException.class, () -> new SimpleText(null));
        assertThrows(NullPointerException.class, () -> new HtmlDecorator(null));
    }
}
