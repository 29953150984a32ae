package org.iceforge.tiercache;

import org.iceforge.tiercache.aws.TierCacheAwsProperties;
import org.iceforge.tiercache.config.TierCacheProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({TierCacheProperties.class, TierCacheAwsProperties.class})
public class TierCacheApplication {

	public static void main(String[] args) {
		SpringApplication.run(TierCacheApplication.class, args);
	}
}
