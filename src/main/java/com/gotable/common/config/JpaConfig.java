package com.gotable.common.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/** {@code @CreatedDate} 컬럼용 JPA Auditing 활성화 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
