package com.bookstay.reservations.document;

import com.bookstay.common.database.AbstractDocument;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * 예약 문서.
 *
 * <p>userId는 인증 서비스의 사용자 id를 그대로 저장한 역참조일 뿐이다.
 * 사용자 문서는 다른 서비스의 저장소에 있으므로 조인하지 않는다.</p>
 */
@Document(collection = "reservations")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReservationDocument extends AbstractDocument {

    private Instant timestamp;   // 예약 생성 시각
    private Instant startDate;
    private Instant endDate;

    @Indexed
    private String userId;

    private String placeId;
    private String invoiceId;    // 결제 게이트웨이 거래 ID

    @Builder
    public ReservationDocument(Instant timestamp, Instant startDate, Instant endDate,
                               String userId, String placeId, String invoiceId) {
        this.timestamp = timestamp;
        this.startDate = startDate;
        this.endDate = endDate;
        this.userId = userId;
        this.placeId = placeId;
        this.invoiceId = invoiceId;
    }
}
