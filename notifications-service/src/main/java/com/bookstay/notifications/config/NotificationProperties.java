package com.bookstay.notifications.config;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 메일 발신 설정 ({@code notifications.*}).
 *
 * @param from    발신 주소 (SMTP 계정과 같게 둔다)
 * @param subject 알림 메일 제목
 */
@Validated
@ConfigurationProperties(prefix = "notifications")
public record NotificationProperties(
        @NotBlank @Email String from,
        @NotBlank String subject
) {}
