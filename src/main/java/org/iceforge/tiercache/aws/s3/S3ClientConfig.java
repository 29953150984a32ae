package org.iceforge.tiercache.aws.s3;

import org.iceforge.tiercache.aws.TierCacheAwsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

/**
 * Builds the {@link S3Client} used by {@link S3RemoteMirror}.
 */
@Configuration
@ConditionalOnProperty(prefix = "tiercache.remote", name = "store", havingValue = "s3", matchIfMissing = true)
public class S3ClientConfig {
    private static final Logger log = LoggerFactory.getLogger(S3ClientConfig.class);

    @Bean(destroyMethod = "close")
    public S3Client s3Client(TierCacheAwsProperties props) {
        TierCacheAwsProperties.S3Properties s3Props = props.s3();
        boolean pathStyle = s3Props != null && s3Props.pathStyleAccess();

        S3ClientBuilder b = S3Client.builder()
                .credentialsProvider(DefaultCredentialsProvider.create())
                .serviceConfiguration(
                        S3Configuration.builder()
                                .pathStyleAccessEnabled(pathStyle)
                                .build()
                );

        if (props.region() != null && !props.region().isBlank()) {
            b = b.region(Region.of(props.region()));
        }
        if (s3Props != null && s3Props.endpoint() != null && !s3Props.endpoint().isBlank()) {
            b = b.endpointOverride(URI.create(s3Props.endpoint()));
        }

        log.info("Creating S3 client: region={} endpoint={} pathStyle={}",
                props.region() == null ? "<default>" : props.region(),
                s3Props == null || s3Props.endpoint() == null ? "<default>" : s3Props.endpoint(),
                pathStyle);
        return b.build();
    }
}
