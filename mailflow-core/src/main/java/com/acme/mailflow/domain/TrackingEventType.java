package com.acme.mailflow.domain;

public enum TrackingEventType {
  OPEN,
  CLICK,
  REPLY,
  BOUNCE,
  UNSUBSCRIBE
}
