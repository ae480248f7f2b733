package org.iceforge.efsguard;

import org.iceforge.efsguard.aws.EfsGuardAwsProperties;
import org.iceforge.efsguard.jdbc.EfsGuardJdbcProperties;
import org.iceforge.efsguard.lock.LockProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({EfsGuardAwsProperties.class, LockProperties.class, EfsGuardJdbcProperties.class})
public class EfsGuardApplication {

	public static void main(String[] args) {
		SpringApplication.run(EfsGuardApplication.class, args);
	}
}
