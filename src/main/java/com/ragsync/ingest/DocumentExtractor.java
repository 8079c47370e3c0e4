package com.ragsync.ingest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Pattern;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Turns one parsed knowledge file into logical documents.
 *
 * <p>Arrays yield one document per element, objects one document per field, and any other value a
 * single document covering the whole file. The text of every document starts with a small
 * {@code Source:}/{@code Topic:} header so that each chunk carries its own context once embedded.
 */
public class DocumentExtractor {
    static final List<String> LABEL_KEYS = List.of("title", "company", "name", "question", "label", "role");

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-zA-Z0-9]+");

    private final ObjectWriter bodyWriter = JsonMapper.builder().build().writer(new BodyPrettyPrinter());

    public Stream<SourceDocument> extract(String source, JsonNode payload) {
        if (payload.isArray()) {
            return IntStream.range(0, payload.size())
                    .mapToObj(index -> {
                        JsonNode entry = payload.get(index);
                        String topic = guessLabel(entry).orElse(source + "-" + (index + 1));
                        return document(source, topic, entry);
                    });
        }
        if (payload.isObject()) {
            Spliterator<Map.Entry<String, JsonNode>> fields = Spliterators.spliteratorUnknownSize(
                    payload.fields(), Spliterator.ORDERED);
            return StreamSupport.stream(fields, false)
                    .map(field -> document(source, field.getKey(), field.getValue()));
        }
        String text = "Source: " + source + "\n\n" + plainText(payload);
        return Stream.of(new SourceDocument(source + "-all", source, text));
    }

    Optional<String> guessLabel(JsonNode entry) {
        if (!entry.isObject()) {
            return Optional.empty();
        }
        for (String key : LABEL_KEYS) {
            JsonNode value = entry.get(key);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return Optional.of(value.asText().strip());
            }
        }
        return Optional.empty();
    }

    String renderBody(JsonNode entry) {
        if (entry.isContainerNode()) {
            try {
                return bodyWriter.writeValueAsString(entry);
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        }
        return plainText(entry);
    }

    public static String slugify(String value) {
        String slug = NON_ALPHANUMERIC.matcher(value).replaceAll("-");
        slug = stripHyphens(slug).toLowerCase(Locale.ROOT);
        return slug.isEmpty() ? "entry" : slug;
    }

    private SourceDocument document(String source, String topic, JsonNode value) {
        String text = ("Source: " + source + "\nTopic: " + topic + "\n\n" + renderBody(value)).strip();
        return new SourceDocument(source + "-" + slugify(topic), topic, text);
    }

    private static String plainText(JsonNode value) {
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static String stripHyphens(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '-') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '-') {
            end--;
        }
        return value.substring(start, end);
    }

    // Two-space indent, "\n" line breaks, "key": value separators and {} / [] for empty containers.
    private static final class BodyPrettyPrinter extends DefaultPrettyPrinter {
        private static final long serialVersionUID = 1L;

        BodyPrettyPrinter() {
            DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
            indentObjectsWith(indenter);
            indentArraysWith(indenter);
        }

        BodyPrettyPrinter(BodyPrettyPrinter base) {
            super(base);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new BodyPrettyPrinter(this);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator generator) throws IOException {
            generator.writeRaw(": ");
        }

        @Override
        public void writeEndObject(JsonGenerator generator, int nrOfEntries) throws IOException {
            if (nrOfEntries > 0) {
                super.writeEndObject(generator, nrOfEntries);
                return;
            }
            if (!_objectIndenter.isInline()) {
                --_nesting;
            }
            generator.writeRaw('}');
        }

        @Override
        public void writeEndArray(JsonGenerator generator, int nrOfValues) throws IOException {
            if (nrOfValues > 0) {
                super.writeEndArray(generator, nrOfValues);
                return;
            }
            if (!_arrayIndenter.isInline()) {
                --_nesting;
            }
            generator.writeRaw(']');
        }
    }
}
