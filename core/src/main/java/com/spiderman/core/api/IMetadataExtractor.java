package com.spiderman.core.api;

import com.spiderman.core.model.PageMetadata;

/** head 태그(title/meta)에서 페이지 메타 추출. 태그가 없어도 예외 없음. */
@FunctionalInterface
public interface IMetadataExtractor {
    PageMetadata extract(String html);
}
