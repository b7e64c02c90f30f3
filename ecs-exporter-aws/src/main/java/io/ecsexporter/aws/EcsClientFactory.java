package io.ecsexporter.aws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ecs.EcsAsyncClient;
import software.amazon.awssdk.services.ecs.EcsAsyncClientBuilder;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.StsClientBuilder;
import software.amazon.awssdk.services.sts.auth.StsAssumeRoleCredentialsProvider;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;

/**
 * Builds the ECS client from region and role settings.
 *
 * Without a role the default credential chain is used. With a role, the
 * default chain is used to assume it through STS and the temporary
 * credentials are refreshed in the background.
 */
public class EcsClientFactory {

    private static final Logger log = LoggerFactory.getLogger(EcsClientFactory.class);

    public static final String DEFAULT_SESSION_NAME = "aws-ecs-exporter";

    private final String region;
    private final String role;
    private final String externalId;
    private final String sessionName;

    /**
     * @param region      AWS region, {@code null} to use the SDK's region provider chain
     * @param role        role ARN to assume, {@code null} for none
     * @param externalId  external id for the assume-role call, may be {@code null}
     * @param sessionName session name for the assume-role call, {@code null} for the default
     */
    public EcsClientFactory(String region, String role, String externalId, String sessionName) {
        this.region = blankToNull(region);
        this.role = blankToNull(role);
        this.externalId = blankToNull(externalId);
        this.sessionName = blankToNull(sessionName) == null ? DEFAULT_SESSION_NAME : sessionName;
    }

    public EcsAsyncClient create() {
        EcsAsyncClientBuilder builder = EcsAsyncClient.builder()
                .credentialsProvider(credentialsProvider());
        if (region != null) {
            builder.region(Region.of(region));
        }
        log.info("Created ECS client: region={}, role={}",
                region == null ? "<default>" : region, role == null ? "<none>" : role);
        return builder.build();
    }

    AwsCredentialsProvider credentialsProvider() {
        if (role == null) {
            return DefaultCredentialsProvider.create();
        }
        StsClientBuilder sts = StsClient.builder();
        if (region != null) {
            sts.region(Region.of(region));
        }
        AssumeRoleRequest request = AssumeRoleRequest.builder()
                .roleArn(role)
                .roleSessionName(sessionName)
                .externalId(externalId)
                .build();
        return StsAssumeRoleCredentialsProvider.builder()
                .stsClient(sts.build())
                .refreshRequest(request)
                .asyncCredentialUpdateEnabled(true)
                .build();
    }

    String getSessionName() {
        return sessionName;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
