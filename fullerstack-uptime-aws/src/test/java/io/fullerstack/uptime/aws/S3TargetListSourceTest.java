package io.fullerstack.uptime.aws;

import io.fullerstack.uptime.core.config.ConfigurationException;
import io.fullerstack.uptime.core.config.ObjectLocation;
import io.fullerstack.uptime.core.config.TargetListParser;
import io.fullerstack.uptime.core.model.MonitoredTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for S3TargetListSource with mocked AWS SDK.
 */
@ExtendWith(MockitoExtension.class)
class S3TargetListSourceTest {

    private static final ObjectLocation LOCATION = new ObjectLocation("ping-config", "urls.json");

    @Mock
    private S3Client mockClient;

    private S3TargetListSource source;

    @BeforeEach
    void setUp() {
        source = new S3TargetListSource(mockClient, new TargetListParser());
    }

    private void givenObject(String json) {
        when(mockClient.getObjectAsBytes(any(GetObjectRequest.class)))
            .thenReturn(ResponseBytes.fromByteArray(
                GetObjectResponse.builder().build(),
                json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void shouldLoadTargetsInDocumentOrder() {
        // Given
        givenObject("{\"urls\": [\"example.com\", \"https://bad.example.com/health\", \"localhost:8080\"]}");

        // When / Then
        assertThat(source.load(LOCATION))
            .extracting(MonitoredTarget::url)
            .containsExactly("example.com", "https://bad.example.com/health", "localhost:8080");

        ArgumentCaptor<GetObjectRequest> captor = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(mockClient).getObjectAsBytes(captor.capture());
        assertThat(captor.getValue().bucket()).isEqualTo("ping-config");
        assertThat(captor.getValue().key()).isEqualTo("urls.json");
    }

    @Test
    void shouldReportMissingObject() {
        when(mockClient.getObjectAsBytes(any(GetObjectRequest.class)))
            .thenThrow(NoSuchKeyException.builder().message("The specified key does not exist.").build());

        assertThatThrownBy(() -> source.load(LOCATION))
            .isInstanceOf(ConfigurationException.class)
            .hasMessage("URL list not found: s3://ping-config/urls.json");
    }

    @Test
    void shouldReportMissingBucket() {
        when(mockClient.getObjectAsBytes(any(GetObjectRequest.class)))
            .thenThrow(NoSuchBucketException.builder().message("The specified bucket does not exist").build());

        assertThatThrownBy(() -> source.load(LOCATION))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("s3://ping-config/urls.json");
    }

    @Test
    void shouldReportUnreachableStore() {
        when(mockClient.getObjectAsBytes(any(GetObjectRequest.class)))
            .thenThrow(SdkClientException.create("Unable to load credentials"));

        assertThatThrownBy(() -> source.load(LOCATION))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Unable to load credentials");
    }

    @Test
    void shouldRejectMalformedDocumentNamingItsLocation() {
        givenObject("{\"targets\": [\"example.com\"]}");

        assertThatThrownBy(() -> source.load(LOCATION))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("s3://ping-config/urls.json");
    }
}
