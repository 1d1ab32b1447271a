package com.scholary.recipe.media.transfer;

import com.scholary.recipe.media.asset.UploadProtocol;
import com.scholary.recipe.media.client.CancellationToken;
import com.scholary.recipe.media.client.MediaFile;
import com.scholary.recipe.media.client.UploadTarget;
import java.util.concurrent.CompletableFuture;

/**
 * Moves the bytes of a file to an upload target using one protocol.
 *
 * <p>Implementations report progress to the sink as they go and report 100 once the host accepted
 * the file. Failures complete the future with {@link TransferException}.
 */
public interface TransferStrategy {

  UploadProtocol protocol();

  CompletableFuture<Void> transfer(
      UploadTarget target, MediaFile file, ProgressSink progress, CancellationToken token);
}
