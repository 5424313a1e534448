package net.clipforge.config;

import net.clipforge.support.storage.InMemoryObjectStore;
import net.clipforge.support.storage.ObjectStore;
import net.clipforge.support.storage.S3ObjectStorageGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * Selects the {@link ObjectStore} implementation: S3 when its beans exist, process memory otherwise.
 */
@Configuration
public class ObjectStoreConfig {

    private static final Logger logger = LoggerFactory.getLogger(ObjectStoreConfig.class);

    @Bean
    public ObjectStore objectStore(ObjectProvider<S3Client> s3Client,
                                   ObjectProvider<S3Presigner> s3Presigner,
                                   @Value("${s3.bucket-name:${S3_BUCKET:}}") String bucketName) {
        S3Client client = s3Client.getIfAvailable();
        S3Presigner presigner = s3Presigner.getIfAvailable();
        if (client == null || presigner == null) {
            logger.warn("No S3 client configured; media objects are kept in memory and lost on restart.");
            return new InMemoryObjectStore();
        }
        S3ObjectStorageGateway gateway = new S3ObjectStorageGateway(client, presigner, bucketName);
        gateway.validateConfiguration();
        return gateway;
    }
}
