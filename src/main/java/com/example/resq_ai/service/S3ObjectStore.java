package com.example.resq_ai.service;

import com.example.resq_ai.dto.MediaReference;
import com.example.resq_ai.dto.RawMedia;
import com.example.resq_ai.exception.ObjectFetchException;
import com.example.resq_ai.service.Interfaces.ObjectStore;
import com.example.resq_ai.util.ContentTypes;
import com.example.resq_ai.util.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;

public class S3ObjectStore implements ObjectStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStore.class);

    private final S3Client s3;
    private final long maxObjectBytes;
    private final Duration defaultTimeout;

    public S3ObjectStore(S3Client s3, long maxObjectBytes, Duration defaultTimeout) {
        this.s3 = s3;
        this.maxObjectBytes = maxObjectBytes;
        this.defaultTimeout = defaultTimeout;
    }

    @Override
    public RawMedia fetch(String bucket, String key, Duration timeout) {
        requireText(bucket, "bucket");
        requireText(key, "key");
        Duration callTimeout = timeout != null ? timeout : defaultTimeout;
        if (callTimeout.isZero() || callTimeout.isNegative()) {
            throw new ObjectFetchException(ErrorKind.TIMEOUT, "No time left to fetch " + bucket + "/" + key);
        }

        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .overrideConfiguration(c -> c.apiCallTimeout(callTimeout))
                .build();

        long t0 = System.nanoTime();
        try (ResponseInputStream<GetObjectResponse> in = s3.getObject(request)) {
            GetObjectResponse response = in.response();
            Long declared = response.contentLength();
            if (declared != null && declared > maxObjectBytes) {
                in.abort();
                throw tooLarge(bucket, key, declared);
            }

            byte[] bytes = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8L, maxObjectBytes + 1));
            if (bytes.length > maxObjectBytes) {
                in.abort();
                throw tooLarge(bucket, key, bytes.length);
            }

            String contentType = ContentTypes.resolve(response.contentType(), key);
            LOGGER.info("FETCH ok store=s3 bucket={} key={} bytes={} contentType={} in={}ms",
                    bucket, key, bytes.length, contentType, (System.nanoTime() - t0) / 1_000_000);
            return new RawMedia(new MediaReference(bucket, key), bytes, contentType, response.metadata());
        } catch (NoSuchKeyException | NoSuchBucketException e) {
            throw new ObjectFetchException(ErrorKind.NOT_FOUND, "Object not found: " + bucket + "/" + key, e);
        } catch (S3Exception e) {
            throw classify(bucket, key, e);
        } catch (ApiCallTimeoutException | ApiCallAttemptTimeoutException | AbortedException e) {
            throw new ObjectFetchException(ErrorKind.TIMEOUT, "Fetch aborted after " + callTimeout.toMillis() + "ms: " + bucket + "/" + key, e);
        } catch (SdkClientException e) {
            throw new ObjectFetchException(ErrorKind.TRANSIENT, "Object store unreachable: " + e.getMessage(), e);
        } catch (InterruptedIOException e) {
            Thread.currentThread().interrupt();
            throw new ObjectFetchException(ErrorKind.TIMEOUT, "Fetch interrupted: " + bucket + "/" + key, e);
        } catch (IOException e) {
            throw new ObjectFetchException(ErrorKind.TRANSIENT, "Object stream failed: " + bucket + "/" + key, e);
        }
    }

    @Override
    public String name() {
        return "s3";
    }

    private ObjectFetchException classify(String bucket, String key, S3Exception e) {
        int status = e.statusCode();
        String ref = bucket + "/" + key;
        // error details from the store may echo request headers; only the status and code are kept
        String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
        if (status == 404) {
            return new ObjectFetchException(ErrorKind.NOT_FOUND, "Object not found: " + ref, e);
        }
        if (status == 401 || status == 403) {
            return new ObjectFetchException(ErrorKind.UNAUTHORIZED, "Access denied: " + ref, e);
        }
        if (status == 400) {
            return new ObjectFetchException(ErrorKind.INVALID_INPUT, "Store rejected reference " + ref + " code=" + code, e);
        }
        return new ObjectFetchException(ErrorKind.TRANSIENT, "Store error status=" + status + " code=" + code + " for " + ref, e);
    }

    private ObjectFetchException tooLarge(String bucket, String key, long size) {
        return new ObjectFetchException(ErrorKind.PAYLOAD_TOO_LARGE,
                "Object " + bucket + "/" + key + " has " + size + " bytes, limit is " + maxObjectBytes);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ObjectFetchException(ErrorKind.INVALID_INPUT, field + " must not be empty");
        }
    }
}
