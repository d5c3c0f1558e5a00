package com.realtime.dm.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "app.dm")
public class DmProps {
    /** 메시지 페이지 기본/최대 크기 */
    private int pageDefaultLimit = 50;
    private int pageMaxLimit = 100;

    /** 본문에서 추출한 순수 텍스트 길이 상한 */
    private int maxTextLength = 2000;
    /** 직렬화된 문서(JSON) 길이 상한 = 컬럼 길이 */
    private int maxDocumentLength = 8000;

    private int searchDefaultLimit = 20;
    private int searchMaxLimit = 100;
}
