package com.spiderman.core.service.export;

import com.spiderman.core.document.DocumentJson;
import com.spiderman.core.model.Document;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * pretty JSON 배열 싱크. 레코드는 메모리에 모았다가 close() 때 파일을 덮어쓴다.
 * close 전에 쓴 내용을 보려면 flush().
 */
public class JsonArrayExporter implements DocumentExporter {

    private final Path file;
    private final List<Document> buffer = new ArrayList<>();

    public JsonArrayExporter(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public void append(Document doc) {
        buffer.add(Objects.requireNonNull(doc, "doc"));
    }

    public int buffered() { return buffer.size(); }

    /** 지금까지 모은 레코드 전체로 파일을 다시 쓴다 */
    public void flush() throws IOException {
        write(file, buffer);
    }

    @Override
    public void close() throws IOException {
        flush();
    }

    @Override
    public Path target() { return file; }

    /** 한 번에 배열 파일 쓰기 (덮어쓰기) */
    public static Path write(Path file, List<Document> docs) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (OutputStream out = Files.newOutputStream(file,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            DocumentJson.writeArray(docs, out);
        }
        return file;
    }
}
