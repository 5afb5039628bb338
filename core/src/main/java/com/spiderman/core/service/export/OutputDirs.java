package com.spiderman.core.service.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;

/** 출력 디렉터리 정리. 하위 디렉터리는 건드리지 않고 일반 파일만 지운다. */
public final class OutputDirs {

    private static final Logger LOG = LoggerFactory.getLogger(OutputDirs.class);

    private OutputDirs() {}

    /** @return 지운 파일 수 (디렉터리가 없으면 0) */
    public static int clear(Path dir) throws IOException {
        if (dir == null || !Files.isDirectory(dir)) return 0;
        int n = 0;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir)) {
            for (Path p : ds) {
                if (Files.isRegularFile(p)) {
                    Files.delete(p);
                    n++;
                }
            }
        }
        LOG.debug("Cleared {} file(s) in {}", n, dir);
        return n;
    }
}
