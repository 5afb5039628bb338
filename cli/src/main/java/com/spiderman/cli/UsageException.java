package com.spiderman.cli;

/** 잘못된 명령행 인자 / 설정 값. 종료 코드 2로 끝난다. */
public class UsageException extends Exception {
    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
