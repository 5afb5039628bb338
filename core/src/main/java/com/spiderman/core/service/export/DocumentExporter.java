package com.spiderman.core.service.export;

import com.spiderman.core.model.Document;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 레코드 싱크 계약.
 * 대상 파일이 없으면 만든다. append를 레코드마다 부르는 것과 appendAll 한 번은 결과가 같다.
 */
public interface DocumentExporter extends Closeable {

    void append(Document doc) throws IOException;

    default void appendAll(List<Document> docs) throws IOException {
        for (Document d : docs) append(d);
    }

    /** 기록 대상 경로 */
    Path target();

    @Override
    default void close() throws IOException {}
}
