package me.golemcore.context.lexical;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JaccardSimilarityComponentTest {

    private JaccardSimilarityComponent component;

    @BeforeEach
    void setUp() {
        component = new JaccardSimilarityComponent();
    }

    @Test
    void shouldReturnOneForIdenticalContent() {
        assertEquals(1.0, component.similarity("User likes green tea", "User likes green tea"));
    }

    @Test
    void shouldIgnoreCaseAndWhitespace() {
        assertEquals(1.0, component.similarity("User LIKES   green tea", "user likes\tgreen\ntea"));
    }

    @Test
    void shouldSplitOnUnicodeSpaces() {
        assertEquals(Set.of("user", "likes", "tea"), component.tokenize("user\u00A0likes\u2003tea"));
        assertEquals(1.0, component.similarity("user\u00A0likes tea", "user likes\u202Ftea"));
    }

    @Test
    void shouldComputeIntersectionOverUnion() {
        // tokens: {user, likes, green, tea} vs {user, likes, black, coffee}
        double similarity = component.similarity("user likes green tea", "user likes black coffee");

        assertEquals(2.0 / 6.0, similarity, 1e-9);
    }

    @Test
    void shouldDropShortTokens() {
        assertEquals(Set.of("likes", "tea"), component.tokenize("I am so in it likes tea"));
        assertEquals(1.0, component.similarity("a bb tea", "tea xy"));
    }

    @Test
    void shouldTreatTwoEmptyTokenSetsAsIdentical() {
        assertEquals(1.0, component.similarity("", "a b"));
        assertEquals(1.0, component.similarity(null, "   "));
    }

    @Test
    void shouldTreatEmptyAgainstNonEmptyAsDisjoint() {
        assertEquals(0.0, component.similarity("", "user likes tea"));
        assertEquals(0.0, component.similarity("user likes tea", "on"));
    }

    @Test
    void shouldBeSymmetric() {
        String first = "Daniel works as engineer in Berlin";
        String second = "Daniel lives in Berlin with family";

        assertEquals(component.similarity(first, second), component.similarity(second, first));
        assertTrue(component.similarity(first, second) > 0.0);
    }

    @Test
    void shouldExposeSimilarityComponentType() {
        assertEquals("similarity", component.getComponentType());
    }
}
