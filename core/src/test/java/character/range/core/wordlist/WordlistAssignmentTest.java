/*
 * Copyright (c) 2022-2023 Felix Kirchmann.
 * Distributed under the MIT License (license terms are at http://opensource.org/licenses/MIT).
 */

package character.range.core.wordlist;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WordlistAssignmentTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void rejectsInvalidBounds() {
        assertThatThrownBy(() -> new WordlistAssignment(-1, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WordlistAssignment(6, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new WordlistAssignment(5, 5).isEmpty()).isTrue();
    }

    @Test
    void overlapsOnlyWhenSharingAnIndex() {
        WordlistAssignment middle = new WordlistAssignment(10, 20);

        assertThat(middle.overlaps(new WordlistAssignment(19, 25))).isTrue();
        assertThat(middle.overlaps(new WordlistAssignment(20, 25))).isFalse();
        assertThat(middle.overlaps(new WordlistAssignment(0, 10))).isFalse();
        assertThat(middle.size()).isEqualTo(10);
    }

    @Test
    void ordersByBeginThenEnd() {
        assertThat(new WordlistAssignment(0, 5)).isLessThan(new WordlistAssignment(1, 2));
        assertThat(new WordlistAssignment(0, 5)).isLessThan(new WordlistAssignment(0, 6));
    }

    @Test
    void toStringGroupsDigits() {
        assertThat(new WordlistAssignment(1000, 1234567)).hasToString("[1.000; 1.234.567)");
    }

    @Test
    void serializesToJson() throws Exception {
        JsonNode tree = mapper.valueToTree(new WordlistAssignment(8, 16));

        assertThat(tree.get("beginIndex").asLong()).isEqualTo(8);
        assertThat(tree.get("endIndex").asLong()).isEqualTo(16);
        assertThat(tree.has("empty")).isFalse();

        WordlistAssignment read = mapper.readValue(mapper.writeValueAsString(tree), WordlistAssignment.class);
        assertThat(read).isEqualTo(new WordlistAssignment(8, 16));
    }
}
