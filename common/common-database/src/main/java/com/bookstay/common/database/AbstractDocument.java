package com.bookstay.common.database;

import lombok.Getter;
import org.springframework.data.annotation.Id;

/**
 * 모든 문서 타입의 공통 식별자.
 *
 * <p>id는 {@link DocumentRepository#create}에서만 할당되고 이후 변경되지 않는다.
 * 외부에서 id를 지정할 수 있는 setter는 제공하지 않는다.</p>
 */
@Getter
public abstract class AbstractDocument {

    @Id
    private String id;

    void assignId(String id) {
        this.id = id;
    }
}
