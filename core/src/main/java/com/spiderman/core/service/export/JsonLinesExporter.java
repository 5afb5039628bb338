package com.spiderman.core.service.export;

import com.spiderman.core.document.DocumentJson;
import com.spiderman.core.model.Document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * JSONL 싱크: 레코드 1개 = 한 줄, 항상 파일 끝에 이어 쓴다.
 * 호출마다 열고 닫으므로 중간에 죽어도 앞선 레코드는 남는다.
 */
public class JsonLinesExporter implements DocumentExporter {

    private final Path file;

    public JsonLinesExporter(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public void append(Document doc) throws IOException {
        Objects.requireNonNull(doc, "doc");
        write(DocumentJson.toJson(doc) + "\n");
    }

    @Override
    public void appendAll(List<Document> docs) throws IOException {
        if (docs.isEmpty()) return;
        StringBuilder sb = new StringBuilder();
        for (Document d : docs) sb.append(DocumentJson.toJson(d)).append('\n');
        write(sb.toString());
    }

    @Override
    public Path target() { return file; }

    private void write(String lines) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(file, lines, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }
}
