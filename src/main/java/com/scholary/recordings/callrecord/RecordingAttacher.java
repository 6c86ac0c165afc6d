package com.scholary.recordings.callrecord;

import com.scholary.recordings.error.ConflictException;
import com.scholary.recordings.error.NotFoundException;
import com.scholary.recordings.error.NotFoundException.What;
import com.scholary.recordings.error.ValidationException;
import com.scholary.recordings.location.RecordingLocation;
import com.scholary.recordings.logging.StructuredLogger;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The only writer of {@link CallRecord} recording locations.
 *
 * <p>Attachment is a single conditional update, so of any number of concurrent attempts for one
 * record at most one succeeds. The others get a {@link ConflictException} naming the location that
 * won.
 */
@Service
public class RecordingAttacher {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecordingAttacher.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final CallRecordRepository repository;

  public RecordingAttacher(CallRecordRepository repository) {
    this.repository = repository;
  }

  /**
   * Attach a stored recording to its call record.
   *
   * @throws NotFoundException if the call record does not exist
   * @throws ConflictException if a recording is already attached, including the same one
   * @throws ValidationException if the encoded location does not fit the column
   */
  @Transactional
  public void attach(UUID callRecordId, RecordingLocation location) {
    String encoded = location.encode();
    if (encoded.length() > CallRecord.MAX_LOCATION_LENGTH) {
      throw new ValidationException(
          String.format(
              "Recording location exceeds %d characters", CallRecord.MAX_LOCATION_LENGTH));
    }

    if (repository.attachIfAbsent(callRecordId, encoded) == 1) {
      structuredLogger.logRecordingAttached(callRecordId.toString(), encoded);
      return;
    }

    CallRecord record =
        repository
            .findById(callRecordId)
            .orElseThrow(() -> new NotFoundException(What.CALL_RECORD, callRecordId.toString()));
    RecordingLocation existing =
        record
            .getRecordingLocation()
            .orElseThrow(
                () -> new IllegalStateException("Attach rejected but no location is set: " + callRecordId));

    LOGGER.info(
        "Recording already attached: callRecordId={}, existing={}, rejected={}",
        callRecordId,
        existing,
        location);
    throw new ConflictException("Recording already attached to call record " + callRecordId, existing);
  }
}
