package com.scholary.recipe.media.transfer;

import com.scholary.recipe.media.asset.UploadProtocol;
import com.scholary.recipe.media.client.CancellationToken;
import com.scholary.recipe.media.client.MediaFile;
import com.scholary.recipe.media.client.UploadTarget;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the bytes of a file to the upload target issued by the broker.
 *
 * <p>Picks the {@link TransferStrategy} for the target's protocol. Progress reaching the caller's
 * sink is clamped to 0..100 and never decreases within one transfer, whatever the strategy does
 * internally.
 */
public class TransferClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(TransferClient.class);

  private final Map<UploadProtocol, TransferStrategy> strategies =
      new EnumMap<>(UploadProtocol.class);

  public TransferClient(List<TransferStrategy> strategies) {
    for (TransferStrategy strategy : strategies) {
      this.strategies.put(strategy.protocol(), strategy);
    }
    LOGGER.info("Initialized transfer client: protocols={}", this.strategies.keySet());
  }

  /**
   * Transfer a file.
   *
   * @param target where to send the file
   * @param file the file
   * @param progress receives percentages while bytes are sent
   * @param token stops the transfer
   * @return completes when the upload host accepted the whole file
   */
  public CompletableFuture<Void> transfer(
      UploadTarget target, MediaFile file, ProgressSink progress, CancellationToken token) {
    TransferStrategy strategy = strategies.get(target.protocol());
    if (strategy == null) {
      return CompletableFuture.failedFuture(
          new IllegalStateException("No transfer strategy for protocol " + target.protocol()));
    }
    LOGGER.info(
        "Transferring {}: assetId={}, protocol={}, bytes={}",
        file.name(),
        target.assetId(),
        target.protocol().value(),
        file.size());
    return strategy.transfer(target, file, new MonotonicProgressSink(progress), token);
  }
}
