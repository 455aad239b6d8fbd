package com.challenges.mxql.category;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MetaFileCategoryCatalogTest {
    private static MetaFileCategoryCatalog catalog;

    @BeforeAll
    public static void loadCatalog() throws URISyntaxException {
        Path directory = Path.of(MetaFileCategoryCatalogTest.class.getResource("/categories").toURI());
        catalog = new MetaFileCategoryCatalog(directory);
    }

    @Test
    public void testIndexesReadableFiles() {
        assertEquals(2, catalog.size());
        assertTrue(catalog.lookup("broken").isEmpty());
    }

    @Test
    public void testEnglishFieldsWin() {
        CategoryMetadata metadata = catalog.lookup("db_postgresql_counter").orElseThrow();

        assertEquals("PostgreSQL Counter", metadata.title());
        assertEquals(4, metadata.fields().size());
        assertTrue(metadata.hasField("tps"));
        assertTrue(metadata.hasField("oid"));
        assertFalse(metadata.hasField("disk"));
        assertEquals("db", metadata.productType());
    }

    @Test
    public void testLanguageVariant() {
        CategoryMetadata korean = catalog.lookup("db_postgresql_counter", "ko").orElseThrow();

        assertEquals("PostgreSQL 카운터", korean.title());
        assertEquals("CPU 사용률", korean.fields().getOnly().description());
        assertEquals("PostgreSQL Counter", catalog.lookup("db_postgresql_counter", "ja").orElseThrow().title());
        assertTrue(catalog.lookup("nope", "ko").isEmpty());
    }

    @Test
    public void testSearchRanksByRelevance() {
        ImmutableList<CategoryMatch> matches = catalog.search("postgresql", 10);

        CategoryMatch match = matches.getOnly();
        assertEquals("db_postgresql_counter", match.categoryName());
        assertEquals(4.0, match.relevance(), 0.0001);
        assertEquals(Lists.immutable.with("en", "ko"), match.languages());
    }

    @Test
    public void testSearchByPlatform() {
        ImmutableList<CategoryMatch> matches = catalog.search("Linux", 10);

        assertEquals("server_base", matches.getOnly().categoryName());
    }

    @Test
    public void testSearchWithoutMatches() {
        assertTrue(catalog.search("kafka", 10).isEmpty());
        assertTrue(catalog.search("   ", 10).isEmpty());
    }

    @Test
    public void testSearchLimit() {
        ImmutableList<CategoryMatch> all = catalog.search("_", 10);

        assertEquals(2, all.size());
        assertEquals("db_postgresql_counter", all.get(0).categoryName());
        assertEquals(1, catalog.search("_", 1).size());
    }

    @Test
    public void testProducts() {
        assertEquals(Lists.immutable.with("db", "server"), catalog.listProducts());
        assertEquals(Lists.immutable.with("db_postgresql_counter"), catalog.findByProduct("DB"));
        assertTrue(catalog.findByProduct("app").isEmpty());
    }

    @Test
    public void testMissingDirectoryGivesEmptyCatalog(@TempDir Path temp) {
        MetaFileCategoryCatalog empty = new MetaFileCategoryCatalog(temp.resolve("absent"));

        assertEquals(0, empty.size());
        assertTrue(empty.lookup("db_postgresql_counter").isEmpty());
    }

    @Test
    public void testNonObjectFilesAreSkipped(@TempDir Path temp) throws IOException {
        Files.writeString(temp.resolve("list.meta"), "[1, 2]", StandardCharsets.UTF_8);
        Files.writeString(temp.resolve("nameless.meta"), "{\"title\": \"x\"}", StandardCharsets.UTF_8);
        Files.writeString(temp.resolve("app_counter.meta"),
            "{\"categoryName\": \"app_counter\", \"pk\": \"oid\", \"fields\": [{\"fieldName\": \"tps\"}, {\"unit\": \"ms\"}]}",
            StandardCharsets.UTF_8);
        Files.writeString(temp.resolve("notes.txt"), "not a category", StandardCharsets.UTF_8);

        MetaFileCategoryCatalog small = new MetaFileCategoryCatalog(temp);

        assertEquals(1, small.size());
        CategoryMetadata metadata = small.lookup("app_counter").orElseThrow();
        assertEquals(Lists.immutable.with("oid"), metadata.pk());
        assertEquals(1, metadata.fields().size());
        assertEquals("", metadata.fields().get(0).unit());
    }
}
