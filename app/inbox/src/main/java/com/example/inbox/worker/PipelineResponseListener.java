package com.example.inbox.worker;

/** ワーカースレッドから呼ばれる。実装は速やかに戻ること。 */
@FunctionalInterface
public interface PipelineResponseListener {

  void onResponse(PipelineResponse response);
}
