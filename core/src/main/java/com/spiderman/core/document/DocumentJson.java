package com.spiderman.core.document;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.spiderman.core.model.Document;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Document ↔ JSON 코덱 (Jackson).
 * crawled_at은 ISO-8601 문자열, 모르는 키는 무시.
 */
public final class DocumentJson {

    private static final ObjectMapper OM = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private DocumentJson() {}

    /** 한 줄 JSON (JSONL 레코드용) */
    public static String toJson(Document doc) throws JsonProcessingException {
        return OM.writeValueAsString(doc);
    }

    public static String toJsonPretty(Document doc) throws JsonProcessingException {
        return OM.writerWithDefaultPrettyPrinter().writeValueAsString(doc);
    }

    public static Document fromJson(String json) throws JsonProcessingException {
        return OM.readValue(json, Document.class);
    }

    /** 여러 레코드를 pretty JSON 배열로 기록. 스트림은 닫지 않는다. */
    public static void writeArray(List<Document> docs, OutputStream out) throws IOException {
        OM.writerWithDefaultPrettyPrinter()
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValue(out, docs);
    }

    public static List<Document> readArray(String json) throws JsonProcessingException {
        return OM.readValue(json, OM.getTypeFactory().constructCollectionType(List.class, Document.class));
    }
}
