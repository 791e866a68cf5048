package io.templatekit.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class CommitOrChangeIdTest {

    private static final String HEX = "0123456789abcdef";

    @Test
    void shortHexTruncatesAndClamps() {
        var id = new CommitOrChangeId(HEX, IdPrefixIndex.TRIVIAL);

        assertThat(id.shortHex(4)).isEqualTo("0123");
        assertThat(id.shortHex(0)).isEmpty();
        assertThat(id.shortHex(99)).isEqualTo(HEX);
        assertThatThrownBy(() -> id.shortHex(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shortestSplitsAtUniquePrefix() {
        var id = new CommitOrChangeId(HEX, hex -> 3);

        assertThat(id.shortest(0)).isEqualTo(new ShortestIdPrefix("012", ""));
        assertThat(id.shortest(6)).isEqualTo(new ShortestIdPrefix("012", "345"));
        assertThat(id.shortest(99)).isEqualTo(new ShortestIdPrefix("012", "3456789abcdef"));
    }

    @Test
    void shortestNeverExceedsTheId() {
        var id = new CommitOrChangeId("ab", hex -> 5);

        assertThat(id.shortest(0)).isEqualTo(new ShortestIdPrefix("ab", ""));
    }

    @Test
    void equalityIsByHex() {
        var a = new CommitOrChangeId(HEX, IdPrefixIndex.TRIVIAL);
        var b = new CommitOrChangeId(HEX, hex -> 4);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b).hasToString(HEX);
    }

    @Test
    void bracketsMarkTheExtraDigits() {
        assertThat(new ShortestIdPrefix("ab", "cd").withBrackets()).isEqualTo("ab[cd]");
        assertThat(new ShortestIdPrefix("ab", "").withBrackets()).isEqualTo("ab");
        assertThat(new ShortestIdPrefix("ab", "cd")).hasToString("abcd");
    }

    @Test
    void hexPrefixIndexLooksAtSortedNeighbours() {
        var index = HexPrefixIndex.of(List.of("abc123", "abd456", "f00"));

        assertThat(index.size()).isEqualTo(3);
        assertThat(index.shortestUniquePrefixLength("abc123")).isEqualTo(3);
        assertThat(index.shortestUniquePrefixLength("abd456")).isEqualTo(3);
        assertThat(index.shortestUniquePrefixLength("f00")).isEqualTo(1);
        assertThat(index.shortestUniquePrefixLength("abe")).isEqualTo(3);
    }

    @Test
    void idThatPrefixesAnotherNeedsAllItsDigits() {
        var index = HexPrefixIndex.of(List.of("ab", "abc"));

        assertThat(index.shortestUniquePrefixLength("ab")).isEqualTo(2);
        assertThat(index.shortestUniquePrefixLength("abc")).isEqualTo(3);
    }

    @Test
    void signatureUsernameIsLocalPartOfEmail() {
        var when = new Timestamp(0, 0);

        assertThat(new Signature("A", "a.b@example.com", when).username()).isEqualTo("a.b");
        assertThat(new Signature("A", "nobody", when).username()).isEqualTo("nobody");
        assertThat(new Signature("A", "a@b", when)).hasToString("A <a@b>");
    }
}
