package com.lingchain.application.port;

import com.lingchain.domain.ChainResult;

public interface ChainPublisher {
  void publish(ChainResult result);
}
