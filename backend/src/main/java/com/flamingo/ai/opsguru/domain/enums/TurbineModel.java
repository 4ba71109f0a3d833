package com.flamingo.ai.opsguru.domain.enums;

import java.util.List;

/** Canonical gas-turbine models known to the assistant, with their built-in aliases. */
public enum TurbineModel {
  SMT60(List.of("smt60", "smt 60", "smt-60", "taurus60", "taurus 60", "taurus-60")),
  SMT130(List.of("smt130", "smt 130", "smt-130", "titan130", "titan 130", "titan-130")),
  TM2500(List.of("tm2500", "tm 2500", "tm-2500"));

  private final List<String> defaultAliases;

  TurbineModel(List<String> defaultAliases) {
    this.defaultAliases = defaultAliases;
  }

  public List<String> getDefaultAliases() {
    return defaultAliases;
  }
}
