package com.github.adamzv.kafkadispatch.domain;

public class ProblemException extends RuntimeException {

  private final Problem problem;

  public ProblemException(Problem problem) {
    super(problem != null ? problem.message() : null);
    this.problem = problem;
  }

  public Problem problem() {
    return problem;
  }

  public boolean hasCode(String code) {
    return problem != null && code.equals(problem.code());
  }
}
