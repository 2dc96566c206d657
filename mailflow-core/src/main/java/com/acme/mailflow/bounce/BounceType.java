package com.acme.mailflow.bounce;

public enum BounceType {
  HARD,
  SOFT
}
