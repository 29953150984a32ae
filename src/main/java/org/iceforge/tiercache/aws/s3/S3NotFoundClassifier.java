package org.iceforge.tiercache.aws.s3;

import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

/**
 * Maps S3 failures onto "the key does not exist" versus "something went wrong".
 * <p>
 * Recognised as not-found:
 * <ul>
 *   <li>{@link NoSuchKeyException}, or error code {@code NoSuchKey};</li>
 *   <li>a bare HTTP 404 with no error code (HEAD-style answers from S3-compatible stores);</li>
 *   <li>error code {@code AccessDenied}, unless the message mentions {@code SignatureDoesNotMatch}.</li>
 * </ul>
 * The last rule is a heuristic: S3 answers AccessDenied for a missing key when the
 * caller lacks list permission, but a denial can also be a real authorization problem.
 * It is approximate and not correct for every backend.
 */
public final class S3NotFoundClassifier {

    static final String NO_SUCH_KEY = "NoSuchKey";
    static final String ACCESS_DENIED = "AccessDenied";
    static final String SIGNATURE_MISMATCH = "SignatureDoesNotMatch";

    private S3NotFoundClassifier() {}

    public static boolean isNotFound(Throwable t) {
        if (t instanceof NoSuchKeyException) {
            return true;
        }
        if (!(t instanceof AwsServiceException)) {
            return false;
        }
        AwsServiceException e = (AwsServiceException) t;
        AwsErrorDetails details = e.awsErrorDetails();
        String code = details == null ? null : details.errorCode();

        if (NO_SUCH_KEY.equals(code)) {
            return true;
        }
        if (ACCESS_DENIED.equals(code)) {
            // a bad signature says nothing about whether the key exists
            return !mentions(e.getMessage(), SIGNATURE_MISMATCH)
                    && !mentions(details.errorMessage(), SIGNATURE_MISMATCH);
        }
        return (code == null || code.isBlank()) && e.statusCode() == 404;
    }

    private static boolean mentions(String text, String needle) {
        return text != null && text.contains(needle);
    }
}
