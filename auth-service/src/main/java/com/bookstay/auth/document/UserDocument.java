package com.bookstay.auth.document;

import com.bookstay.common.database.AbstractDocument;
import com.bookstay.common.dto.UserDto;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 사용자 문서.
 *
 * <p>email에 유니크 인덱스를 건다. 서비스 계층의 사전 중복 검사와 동시에 들어온
 * 같은 이메일 가입 요청이 있더라도 저장소가 둘 중 하나를 거부한다.</p>
 */
@Document(collection = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UserDocument extends AbstractDocument {

    @Indexed(unique = true)
    private String email;

    private String password;   // BCrypt 해시, 응답에는 절대 포함하지 않는다

    public UserDocument(String email, String passwordHash) {
        this.email = email;
        this.password = passwordHash;
    }

    public UserDto toDto() {
        return new UserDto(getId(), email);
    }
}
