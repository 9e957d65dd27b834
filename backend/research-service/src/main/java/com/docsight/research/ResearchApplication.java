package com.docsight.research;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * DocSight Research Service Application
 *
 * 계획 워크플로우를 위한 웹 레퍼런스 자료 수집 서비스
 * - 정적 파싱 우선, 필요 시 브라우저 렌더링으로 콘텐츠 수집
 * - 도메인별 병렬 리서치 (동시 실행 수 제한)
 * - 출처 신뢰도 분류 및 콘텐츠 중복 제거
 */
@SpringBootApplication
public class ResearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResearchApplication.class, args);
    }
}
