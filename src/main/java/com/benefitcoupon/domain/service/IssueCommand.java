package com.benefitcoupon.domain.service;

import com.benefitcoupon.domain.vo.IssueMetadata;

/**
 * 쿠폰 발급 요청
 *
 * @param student 호출자가 STUDENT 역할을 가졌는지 여부
 */
public record IssueCommand(Long userId, Long benefitId, boolean student, IssueMetadata metadata) {

    public IssueCommand {
        if (userId == null) {
            throw new IllegalArgumentException("사용자 ID는 필수입니다");
        }
        if (benefitId == null) {
            throw new IllegalArgumentException("혜택 ID는 필수입니다");
        }
        if (metadata == null) {
            metadata = IssueMetadata.empty();
        }
    }
}
