package com.liquibot.mm.domain;

public enum ClobOrderType {
  GTC,
  GTD,
  FOK,
  FAK,
}
