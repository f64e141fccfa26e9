package io.github.cyfko.metricql.core.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EntityListReader")
class EntityListReaderTest {

    private final EntityListReader reader = new EntityListReader();

    @Test
    @DisplayName("Should read entities with optional roles")
    void shouldReadEntities() {
        // Given
        String json = "[{\"entity\": \"age\", \"value\": 40, \"role\": \"lower\"},"
                + " {\"entity\": \"kpi\", \"value\": \"door to needle\"},"
                + " {\"entity\": \"sex\", \"value\": null, \"extra\": true}]";

        // When
        List<Entity> entities = reader.read(json);

        // Then
        assertEquals(List.of(
                new Entity("age", "40", "lower"),
                new Entity("kpi", "door to needle", null),
                new Entity("sex", null, null)), entities);
    }

    @Test
    @DisplayName("Should read from a stream")
    void shouldReadFromStream() {
        InputStream in = new ByteArrayInputStream("[{\"entity\": \"group_by\", \"value\": \"first seen\"}]"
                .getBytes(StandardCharsets.UTF_8));

        assertEquals(List.of(new Entity("group_by", "first seen")), reader.read(in));
    }

    @Test
    @DisplayName("Should reject malformed documents")
    void shouldRejectMalformed() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> reader.read("[{"));
        assertTrue(exception.getMessage().startsWith("Malformed entity JSON"));

        assertThrows(IllegalArgumentException.class, () -> reader.read("{\"entity\": \"age\"}"));
        assertThrows(IllegalArgumentException.class, () -> reader.read("[{\"value\": 3}]"));
        assertThrows(IllegalArgumentException.class, () -> reader.read("[{\"entity\": 3}]"));
        assertThrows(IllegalArgumentException.class, () -> reader.read("[\"age\"]"));
    }

    @Test
    @DisplayName("Should surface IO failures")
    void shouldSurfaceIoFailures() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("disk gone");
            }

            @Override
            public int read(byte[] buffer, int offset, int length) throws IOException {
                throw new IOException("disk gone");
            }
        };

        UncheckedIOException exception = assertThrows(UncheckedIOException.class, () -> reader.read(broken));
        assertEquals("disk gone", exception.getCause().getMessage());
    }

    @Test
    @DisplayName("Entity roles are matched case-insensitively")
    void entityRoles() {
        Entity entity = new Entity("Age", "3", " Upper ");

        assertTrue(entity.hasRole(Entity.ROLE_UPPER));
        assertFalse(entity.hasRole(Entity.ROLE_LOWER));
        assertEquals("age", entity.normalizedType());
        assertThrows(NullPointerException.class, () -> new Entity(null, "3"));
    }
}
