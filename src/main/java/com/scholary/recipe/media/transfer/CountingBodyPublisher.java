package com.scholary.recipe.media.transfer;

import java.net.http.HttpRequest.BodyPublisher;
import java.nio.ByteBuffer;
import java.util.concurrent.Flow;
import java.util.function.LongConsumer;

/**
 * Body publisher that reports how many bytes it has handed to the HTTP transport.
 *
 * <p>Counts are cumulative and reported after each buffer, before the transport consumes it. This
 * measures bytes written to the connection, which is the closest the JDK client gets to upload
 * progress.
 */
class CountingBodyPublisher implements BodyPublisher {

  private final BodyPublisher delegate;
  private final LongConsumer listener;

  CountingBodyPublisher(BodyPublisher delegate, LongConsumer listener) {
    this.delegate = delegate;
    this.listener = listener;
  }

  @Override
  public long contentLength() {
    return delegate.contentLength();
  }

  @Override
  public void subscribe(Flow.Subscriber<? super ByteBuffer> subscriber) {
    delegate.subscribe(new CountingSubscriber(subscriber));
  }

  private final class CountingSubscriber implements Flow.Subscriber<ByteBuffer> {

    private final Flow.Subscriber<? super ByteBuffer> downstream;
    private long count;

    private CountingSubscriber(Flow.Subscriber<? super ByteBuffer> downstream) {
      this.downstream = downstream;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
      // a retried exchange resubscribes, start over
      count = 0;
      downstream.onSubscribe(subscription);
    }

    @Override
    public void onNext(ByteBuffer item) {
      count += item.remaining();
      listener.accept(count);
      downstream.onNext(item);
    }

    @Override
    public void onError(Throwable throwable) {
      downstream.onError(throwable);
    }

    @Override
    public void onComplete() {
      downstream.onComplete();
    }
  }
}
