package org.iceforge.tiercache.config;

import org.iceforge.tiercache.TieredCache;
import org.iceforge.tiercache.aws.s3.S3RemoteMirror;
import org.iceforge.tiercache.local.DiskContentStore;
import org.iceforge.tiercache.remote.LocalFsRemoteMirror;
import org.iceforge.tiercache.remote.RemoteMirror;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.s3.S3Client;

import java.nio.file.Path;

@Configuration
public class TieredCacheConfig {

    @Bean
    public DiskContentStore diskContentStore(TierCacheProperties props) {
        return new DiskContentStore(Path.of(props.getLocal().getDir()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "tiercache.remote", name = "store", havingValue = "s3", matchIfMissing = true)
    public RemoteMirror s3RemoteMirror(S3Client s3Client, TierCacheProperties props) {
        TierCacheProperties.Remote remote = props.getRemote();
        return new S3RemoteMirror(s3Client, remote.getBucket(), remote.getPrefix());
    }

    @Bean
    @ConditionalOnProperty(prefix = "tiercache.remote", name = "store", havingValue = "local")
    public RemoteMirror localRemoteMirror(TierCacheProperties props) {
        TierCacheProperties.Remote remote = props.getRemote();
        String bucket = remote.getBucket() == null || remote.getBucket().isBlank() ? "tiercache" : remote.getBucket();
        return new LocalFsRemoteMirror(Path.of(remote.getLocalBaseDir()), bucket, remote.getPrefix());
    }

    @Bean
    public TieredCache tieredCache(DiskContentStore disk, RemoteMirror remote, TierCacheProperties props) {
        TierCacheProperties.Replication replication = props.getReplication();
        return new TieredCache(disk, remote, replication.getQueueLength(), replication.getWorkers());
    }
}
