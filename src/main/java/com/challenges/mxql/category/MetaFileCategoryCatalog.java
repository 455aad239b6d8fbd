package com.challenges.mxql.category;

import com.challenges.mxql.payload.PayloadNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.map.primitive.MutableObjectDoubleMap;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;
import org.eclipse.collections.impl.map.mutable.primitive.ObjectDoubleHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Category catalog backed by a directory of {@code *.meta} JSON files.
 * <p>
 * Each file describes one category in one language; {@code name_ko.meta} and
 * {@code name_ja.meta} are language variants of {@code name.meta}. Field lists are taken
 * from the English file when there is one. The directory is indexed once, on construction.
 */
public class MetaFileCategoryCatalog implements CategoryMetadataSource {
    private static final Logger log = LoggerFactory.getLogger(MetaFileCategoryCatalog.class);
    private static final Pattern WORD = Pattern.compile("\\w+");
    private static final String DEFAULT_LANGUAGE = "en";

    private final Path directory;
    private final JsonPayloadReader reader = new JsonPayloadReader();
    private final MutableMap<String, Entry> categories = Maps.mutable.empty();
    private final MutableMap<String, MutableSet<String>> byKeyword = Maps.mutable.empty();
    private final MutableMap<String, MutableSet<String>> byProduct = Maps.mutable.empty();

    public MetaFileCategoryCatalog(Path directory) {
        this.directory = directory;
        index();
    }

    @Override
    public Optional<CategoryMetadata> lookup(String categoryName) {
        return Optional.ofNullable(categories.get(categoryName)).map(entry -> entry.metadata);
    }

    /**
     * The category as described by its {@code language} file, or by the English file when
     * that language has none.
     */
    public Optional<CategoryMetadata> lookup(String categoryName, String language) {
        return Optional.ofNullable(categories.get(categoryName))
            .map(entry -> entry.variants.getIfAbsentValue(language.toLowerCase(Locale.ROOT), entry.metadata));
    }

    public int size() {
        return categories.size();
    }

    /**
     * Categories whose name, title words or platforms match {@code text}, best first.
     */
    public ImmutableList<CategoryMatch> search(String text, int limit) {
        String query = text.toLowerCase(Locale.ROOT).trim();
        if (query.isEmpty()) {
            return Lists.immutable.empty();
        }
        MutableObjectDoubleMap<String> scores = new ObjectDoubleHashMap<>();

        byKeyword.forEachKeyValue((keyword, names) -> {
            if (keyword.contains(query) || query.contains(keyword)) {
                double score = keyword.equals(query) ? 2.0 : 1.0;
                names.forEach(name -> scores.addToValue(name, score));
            }
        });
        categories.keysView().forEach(name -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.contains(query)) {
                scores.addToValue(name, lower.equals(query) ? 3.0 : 2.0);
            }
        });

        return scores.keysView()
            .toSortedList(Comparator.<String>comparingDouble(scores::get).reversed().thenComparing(name -> name))
            .take(limit)
            .collect(name -> {
                Entry entry = categories.get(name);
                return new CategoryMatch(name, entry.metadata.title(), entry.metadata.platforms(),
                    scores.get(name), entry.languages.keysView().toSortedList().toImmutable());
            })
            .toImmutable();
    }

    /**
     * Categories of a product type, the first {@code _} segment of their names.
     */
    public ImmutableList<String> findByProduct(String productType) {
        return byProduct.getIfAbsentValue(productType.toLowerCase(Locale.ROOT), Sets.mutable.empty())
            .toSortedList()
            .toImmutable();
    }

    public ImmutableList<String> listProducts() {
        return byProduct.keysView().toSortedList().toImmutable();
    }

    private void index() {
        if (!Files.isDirectory(directory)) {
            log.warn("Category directory {} does not exist; no categories indexed", directory);
            return;
        }
        MutableList<Path> files = Lists.mutable.empty();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.meta")) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new CategoryCatalogException("Cannot list category directory " + directory, e);
        }
        // English files first so their field lists win
        files.sortThis(Comparator.comparing((Path file) -> !languageOf(file).equals(DEFAULT_LANGUAGE))
            .thenComparing(Path::toString));
        files.forEach(this::indexFile);
        log.debug("Indexed {} categories from {}", categories.size(), directory);
    }

    private void indexFile(Path file) {
        PayloadNode document;
        try (InputStream input = Files.newInputStream(file)) {
            document = reader.read(input);
        } catch (IOException e) {
            log.warn("Skipping unreadable category file {}: {}", file, e.getMessage());
            return;
        }
        if (!(document instanceof PayloadNode.PayloadObject object)) {
            log.warn("Skipping category file {}: top-level value is not an object", file);
            return;
        }
        String name = text(object, "categoryName");
        if (name.isEmpty()) {
            return;
        }

        String language = languageOf(file);
        CategoryMetadata metadata = toMetadata(name, object);
        Entry entry = categories.getIfAbsentPutWith(name, Entry::new, metadata);
        entry.languages.put(language, file.getFileName().toString());
        entry.variants.put(language, metadata);

        byProduct.getIfAbsentPut(entry.metadata.productType().toLowerCase(Locale.ROOT), Sets.mutable::empty).add(name);
        keywordsOf(entry.metadata).forEach(keyword -> byKeyword.getIfAbsentPut(keyword, Sets.mutable::empty).add(name));
    }

    private static CategoryMetadata toMetadata(String name, PayloadNode.PayloadObject object) {
        MutableList<CategoryField> fields = Lists.mutable.empty();
        object.get("fields").ifPresent(node -> {
            if (node instanceof PayloadNode.PayloadArray array) {
                array.elements().forEach(element -> {
                    if (element instanceof PayloadNode.PayloadObject field && !text(field, "fieldName").isEmpty()) {
                        fields.add(new CategoryField(text(field, "fieldName"), text(field, "unit"),
                            text(field, "type"), text(field, "description")));
                    }
                });
            }
        });
        return new CategoryMetadata(name, text(object, "title"), texts(object, "platforms"), texts(object, "pk"),
            fields.toImmutable());
    }

    private static MutableSet<String> keywordsOf(CategoryMetadata metadata) {
        MutableSet<String> keywords = Sets.mutable.with(metadata.categoryName().toLowerCase(Locale.ROOT).split("_"));
        Matcher matcher = WORD.matcher(metadata.title().toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            keywords.add(matcher.group());
        }
        metadata.platforms().forEach(platform -> keywords.add(platform.toLowerCase(Locale.ROOT)));
        return keywords;
    }

    private static String languageOf(Path file) {
        String stem = file.getFileName().toString().replaceFirst("\\.meta$", "");
        if (stem.endsWith("_ko")) {
            return "ko";
        }
        if (stem.endsWith("_ja")) {
            return "ja";
        }
        return DEFAULT_LANGUAGE;
    }

    private static String text(PayloadNode.PayloadObject object, String key) {
        return object.get(key).flatMap(PayloadNode::text).orElse("");
    }

    private static ImmutableList<String> texts(PayloadNode.PayloadObject object, String key) {
        MutableList<String> result = Lists.mutable.empty();
        object.get(key).ifPresent(node -> {
            if (node instanceof PayloadNode.PayloadArray array) {
                array.elements().forEach(element -> element.text().ifPresent(result::add));
            } else {
                node.text().ifPresent(result::add);
            }
        });
        return result.toImmutable();
    }

    private static final class Entry {
        private final CategoryMetadata metadata;
        private final MutableMap<String, String> languages = Maps.mutable.empty();
        private final MutableMap<String, CategoryMetadata> variants = Maps.mutable.empty();

        private Entry(CategoryMetadata metadata) {
            this.metadata = metadata;
        }
    }
}
