package org.iceforge.tiercache.aws;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * AWS client settings. Credentials are never configured here; the SDK default
 * credentials chain supplies them.
 *
 * @param region AWS region, or null to use the SDK default region chain
 * @param s3     S3 endpoint overrides, may be null
 */
@ConfigurationProperties(prefix = "tiercache.aws")
public record TierCacheAwsProperties(
        String region,
        S3Properties s3
) {
    public record S3Properties(
            String endpoint,
            boolean pathStyleAccess
    ) {}
}
