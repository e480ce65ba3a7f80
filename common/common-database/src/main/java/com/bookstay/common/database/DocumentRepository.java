package com.bookstay.common.database;

import com.bookstay.common.exception.BusinessException;
import com.bookstay.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 제네릭 문서 레포지토리 - 문서 타입 하나에 대한 CRUD 엔진.
 *
 * <p>엔티티별 레포지토리(UsersRepository, ReservationsRepository)는 이 클래스를
 * 상속하지 않고 필드로 보유한다(composition). 엔티티 레포지토리가 제공하는 것은
 * 문서 타입과 {@link MongoOperations} 핸들뿐이고, 다섯 가지 연산은 모두 여기서 온다.</p>
 *
 * <h3>에러 의미</h3>
 * <ul>
 *   <li>findOne / findOneAndUpdate / findOneAndDelete: 일치하는 문서가 없으면
 *       {@link ErrorCode#ENTITY_NOT_FOUND} (정상적인 음성 결과)</li>
 *   <li>findMany: 일치하는 문서가 없으면 빈 리스트 (에러 아님)</li>
 *   <li>저장소 연결 실패/타임아웃: {@link ErrorCode#DATABASE_UNAVAILABLE} - NotFound와 절대 섞이지 않는다</li>
 * </ul>
 *
 * <h3>원자성</h3>
 * <p>findOneAndUpdate/findOneAndDelete는 MongoDB의 단일 findAndModify/findAndRemove 명령이다.
 * 레포지토리가 읽고-수정하고-쓰는 방식이 아니므로 같은 문서에 대한 동시 업데이트도
 * 저장소가 문서 단위로 직렬화한다 (필드 단위 last-writer-wins).</p>
 *
 * @param <T> 문서 타입
 */
@Slf4j
public class DocumentRepository<T extends AbstractDocument> {

    private final MongoOperations mongoOperations;
    private final Class<T> documentClass;

    public DocumentRepository(MongoOperations mongoOperations, Class<T> documentClass) {
        this.mongoOperations = mongoOperations;
        this.documentClass = documentClass;
    }

    /**
     * 새 id를 할당하고 문서를 저장한다. 호출자가 넣은 id는 무시된다.
     */
    public T create(T document) {
        document.assignId(new ObjectId().toHexString());
        T saved = execute(() -> mongoOperations.insert(document));
        log.debug("{} created: id={}", documentClass.getSimpleName(), saved.getId());
        return saved;
    }

    public T findOne(Query filter) {
        return find(filter).orElseThrow(() -> notFound(filter));
    }

    /**
     * 존재 여부를 예외 없이 확인하는 조회. 없으면 {@link Optional#empty()}.
     */
    public Optional<T> find(Query filter) {
        return Optional.ofNullable(execute(() -> mongoOperations.findOne(filter, documentClass)));
    }

    public boolean exists(Query filter) {
        return execute(() -> mongoOperations.exists(filter, documentClass));
    }

    // 순서는 보장하지 않는다
    public List<T> findMany(Query filter) {
        return execute(() -> mongoOperations.find(filter, documentClass));
    }

    /**
     * 일치하는 문서 하나에 부분 업데이트를 원자적으로 적용하고 업데이트 후 상태를 반환한다.
     *
     * @throws IllegalArgumentException update가 id를 변경하려는 경우
     */
    public T findOneAndUpdate(Query filter, Update update) {
        if (update.modifies("id") || update.modifies("_id")) {
            throw new IllegalArgumentException("Document id is immutable");
        }
        T updated = execute(() -> mongoOperations.findAndModify(
                filter, update, FindAndModifyOptions.options().returnNew(true), documentClass));
        if (updated == null) {
            throw notFound(filter);
        }
        return updated;
    }

    /**
     * 일치하는 문서 하나를 원자적으로 삭제하고 삭제 전 상태를 반환한다.
     */
    public T findOneAndDelete(Query filter) {
        T deleted = execute(() -> mongoOperations.findAndRemove(filter, documentClass));
        if (deleted == null) {
            throw notFound(filter);
        }
        return deleted;
    }

    /**
     * 저장소 장애를 {@link ErrorCode#DATABASE_UNAVAILABLE}로 변환한다.
     * DuplicateKeyException 같은 나머지 DataAccessException은 호출자가 해석하도록 그대로 던진다.
     */
    private <R> R execute(Supplier<R> operation) {
        try {
            return operation.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            log.error("{} store unavailable", documentClass.getSimpleName(), e);
            throw new BusinessException(ErrorCode.DATABASE_UNAVAILABLE,
                    documentClass.getSimpleName() + " store is unavailable", e);
        }
    }

    private BusinessException notFound(Query filter) {
        log.debug("{} not found: filter={}", documentClass.getSimpleName(), filter.getQueryObject());
        return new BusinessException(ErrorCode.ENTITY_NOT_FOUND,
                documentClass.getSimpleName() + " not found");
    }
}
