package com.scholary.recipe.media.session;

import com.scholary.recipe.media.client.ConfirmationService;
import com.scholary.recipe.media.client.ProcessingPoller;
import com.scholary.recipe.media.client.UploadBroker;
import com.scholary.recipe.media.transfer.TransferClient;

/**
 * Creates upload sessions.
 *
 * <p>Sessions share the stateless pipeline components; each has its own state, so independent
 * uploads never interfere.
 */
public class UploadSessionFactory {

  private final UploadBroker broker;
  private final TransferClient transferClient;
  private final ConfirmationService confirmationService;
  private final ProcessingPoller poller;

  public UploadSessionFactory(
      UploadBroker broker,
      TransferClient transferClient,
      ConfirmationService confirmationService,
      ProcessingPoller poller) {
    this.broker = broker;
    this.transferClient = transferClient;
    this.confirmationService = confirmationService;
    this.poller = poller;
  }

  public UploadSession newSession() {
    return new UploadSession(broker, transferClient, confirmationService, poller);
  }
}
