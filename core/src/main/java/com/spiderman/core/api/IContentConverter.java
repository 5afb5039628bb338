package com.spiderman.core.api;

/** 마크업 → 레코드 본문 텍스트. 빈 입력이면 빈 문자열. */
@FunctionalInterface
public interface IContentConverter {
    String convert(String html);
}
