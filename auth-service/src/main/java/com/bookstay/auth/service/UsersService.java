package com.bookstay.auth.service;

import com.bookstay.auth.document.UserDocument;
import com.bookstay.auth.repository.UsersRepository;
import com.bookstay.common.dto.UserDto;
import com.bookstay.common.exception.BusinessException;
import com.bookstay.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * 사용자 등록과 자격 증명 검증.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UsersService {

    private static final String INVALID_CREDENTIALS = "Credentials are not valid";

    private final UsersRepository usersRepository;
    private final PasswordEncoder passwordEncoder;

    /**
     * 사용자 등록. 이메일은 고유해야 한다.
     *
     * <p>existsByEmail로 먼저 확인하고, 그 사이에 같은 이메일이 끼어들면
     * 유니크 인덱스의 DuplicateKeyException을 같은 DUPLICATE_EMAIL로 변환한다.</p>
     */
    public UserDto register(String email, String password) {
        if (usersRepository.existsByEmail(email)) {
            throw new BusinessException(ErrorCode.DUPLICATE_EMAIL);
        }
        try {
            UserDocument user = usersRepository.create(
                    new UserDocument(email, passwordEncoder.encode(password)));
            log.info("User registered: userId={}", user.getId());
            return user.toDto();
        } catch (DuplicateKeyException e) {
            log.warn("Concurrent registration lost the race: email={}", email);
            throw new BusinessException(ErrorCode.DUPLICATE_EMAIL);
        }
    }

    /**
     * 이메일/비밀번호 검증 (validateCredentials).
     * 사용자가 없는 경우와 비밀번호가 틀린 경우를 같은 메시지로 거부한다.
     */
    public UserDocument verifyUser(String email, String password) {
        return usersRepository.findByEmail(email)
                .filter(user -> passwordEncoder.matches(password, user.getPassword()))
                .orElseThrow(() -> new BusinessException(ErrorCode.UNAUTHORIZED, INVALID_CREDENTIALS));
    }

    public UserDto getUser(String id) {
        return usersRepository.getById(id).toDto();
    }
}
