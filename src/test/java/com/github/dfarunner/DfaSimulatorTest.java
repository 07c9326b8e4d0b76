package com.github.dfarunner;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

/**
 * Tests to maintain the sanity and correctness of DFA simulation.
 */
public class DfaSimulatorTest {
  private static final Logger logger =
      LogManager.getLogger(DfaSimulatorTest.class.getSimpleName());

  // accepts strings with an odd number of a's
  static Dfa<Integer, String> oddNumberOfAs() {
    return Dfa.<Integer, String>newBuilder().states(1, 2).alphabet("a", "b").startState(1)
        .finalState(2).transition(1, "a", 2).transition(1, "b", 1).transition(2, "a", 1)
        .transition(2, "b", 2).build();
  }

  @Test
  public void testAcceptsString() throws InvalidDfaException {
    final Dfa<Integer, String> dfa = oddNumberOfAs();
    DfaValidator.validate(dfa);
    assertTrue(DfaSimulator.accepts(dfa, "abbaa"));
  }

  @Test
  public void testRejectsString() throws InvalidDfaException {
    final Dfa<Integer, String> dfa = oddNumberOfAs();
    DfaValidator.validate(dfa);
    assertFalse(DfaSimulator.accepts(dfa, "abba"));
  }

  @Test
  public void testRoute() {
    final Dfa<Integer, String> dfa = oddNumberOfAs();

    SimulationResult<Integer, String> result =
        DfaSimulator.run(dfa, DfaSimulator.symbolsOf("abbaa"));
    assertTrue(result.isAccepted());
    assertEquals(Arrays.asList(1, 2, 2, 2, 1, 2), result.getRoute());
    assertEquals(Integer.valueOf(2), result.getLastState());
    assertEquals(5, result.getConsumedSymbols());
    assertEquals(Optional.empty(), result.getUnrecognizedSymbol());

    result = DfaSimulator.run(dfa, DfaSimulator.symbolsOf("abba"));
    assertFalse(result.isAccepted());
    assertEquals(Arrays.asList(1, 2, 2, 2, 1), result.getRoute());
  }

  @Test
  public void testRejectsStringWithUnrecognizedCharacter() throws InvalidDfaException {
    final Dfa<Integer, String> dfa = oddNumberOfAs();
    DfaValidator.validate(dfa);
    assertFalse(DfaSimulator.accepts(dfa, "ababaQ"));

    // Q stops the run before the remaining symbols are looked at
    final SimulationResult<Integer, String> result =
        DfaSimulator.run(dfa, DfaSimulator.symbolsOf("aQa"));
    assertFalse(result.isAccepted());
    assertEquals(Optional.of("Q"), result.getUnrecognizedSymbol());
    assertEquals(1, result.getConsumedSymbols());
    assertEquals(Arrays.asList(1, 2), result.getRoute());
  }

  @Test
  public void testUnrecognizedCharacterOnUnvalidatedDfa() {
    // even with a hole in the transition function, out-of-alphabet symbols just reject
    final Dfa<Integer, String> dfa = missingOneB();
    assertFalse(DfaSimulator.accepts(dfa, "Qb"));
  }

  @Test
  public void testThrowsOnUndefinedTransition() {
    final Dfa<Integer, String> dfa = missingOneB();
    // intentionally not validated
    try {
      DfaSimulator.accepts(dfa, "bbbbb");
      fail("state 1 has no transition on b");
    } catch (UndefinedTransitionException expected) {
      assertEquals(1, expected.getState());
      assertEquals("b", expected.getSymbol());
      assertTrue(expected.getMessage().contains(
          "Something went wrong when attempting transition from state '1' on input 'b'"));
    }
  }

  @Test
  public void testEmptyInput() {
    final Dfa<Integer, String> dfa = oddNumberOfAs();
    assertFalse(DfaSimulator.accepts(dfa, ""));
    assertFalse(DfaSimulator.accepts(dfa, Collections.<String>emptyList()));

    final Dfa<Integer, String> startAccepts = Dfa.<Integer, String>newBuilder().states(1, 2)
        .alphabet("a", "b").startState(1).finalStates(1, 2).transition(1, "a", 2)
        .transition(1, "b", 1).transition(2, "a", 1).transition(2, "b", 2).build();
    assertTrue(DfaSimulator.accepts(startAccepts, ""));

    // no transition is attempted, so even a dfa without any transitions answers
    final Dfa<Integer, String> noTransitions =
        Dfa.<Integer, String>newBuilder().states(1).alphabet("a").startState(1).finalState(1)
            .build();
    assertTrue(DfaSimulator.accepts(noTransitions, ""));
    assertEquals(Arrays.asList(1),
        DfaSimulator.run(noTransitions, Collections.<String>emptyList()).getRoute());
  }

  @Test
  public void testNonStringSymbols() throws InvalidDfaException {
    // counts 1 bits modulo 3
    final Dfa<String, Integer> dfa = Dfa.<String, Integer>newBuilder().states("r0", "r1", "r2")
        .alphabet(0, 1).startState("r0").finalState("r0").transition("r0", 0, "r0")
        .transition("r0", 1, "r1").transition("r1", 0, "r1").transition("r1", 1, "r2")
        .transition("r2", 0, "r2").transition("r2", 1, "r0").build();
    DfaValidator.validate(dfa);
    assertTrue(DfaSimulator.accepts(dfa, Arrays.asList(1, 0, 1, 1)));
    assertFalse(DfaSimulator.accepts(dfa, Arrays.asList(1, 0, 1)));
    assertFalse(DfaSimulator.accepts(dfa, Arrays.asList(1, 1, 1, 2)));
  }

  @Test
  public void testSymbolsOf() {
    assertEquals(Collections.emptyList(), DfaSimulator.symbolsOf(""));
    assertEquals(Arrays.asList("a", "b", "a"), DfaSimulator.symbolsOf("aba"));
    // a surrogate pair is one symbol
    assertEquals(Arrays.asList("x", "\uD83D\uDE00"), DfaSimulator.symbolsOf("x\uD83D\uDE00"));
  }

  @Test
  public void testValidatedDfaNeverHitsUndefinedTransition() throws InvalidDfaException {
    final Dfa<Integer, String> dfa = oddNumberOfAs();
    DfaValidator.validate(dfa);
    for (final List<String> input : allInputs(Arrays.asList("a", "b"), 10)) {
      final int as = Collections.frequency(input, "a");
      assertEquals(input.toString(), as % 2 == 1, DfaSimulator.accepts(dfa, input));
    }
  }

  @Test
  public void testOutOfAlphabetSymbolAlwaysRejects() throws InvalidDfaException {
    final Dfa<Integer, String> dfa = oddNumberOfAs();
    DfaValidator.validate(dfa);
    for (final List<String> input : allInputs(Arrays.asList("a", "b", "c"), 6)) {
      if (input.contains("c")) {
        assertFalse(input.toString(), DfaSimulator.accepts(dfa, input));
      }
    }
  }

  @Test
  public void testConcurrentSimulation() throws Exception {
    final Dfa<Integer, String> dfa = oddNumberOfAs();
    DfaValidator.validate(dfa);

    final AtomicInteger correct = new AtomicInteger();
    final AtomicInteger wrong = new AtomicInteger();
    final Runnable simulationWorker = new Runnable() {
      @Override
      public void run() {
        try {
          for (int iter = 0; iter < 1000; iter++) {
            final boolean oddInput = iter % 2 == 1;
            final StringBuilder input = new StringBuilder();
            for (int as = 0; as < iter; as++) {
              input.append(as % 3 == 0 ? "ab" : "a");
            }
            if (DfaSimulator.accepts(dfa, input.toString()) == oddInput) {
              correct.incrementAndGet();
            } else {
              wrong.incrementAndGet();
            }
          }
        } catch (RuntimeException problem) {
          logger.error("simulation worker encountered an issue", problem);
          wrong.incrementAndGet();
        }
      }
    };

    int workerCount = 5;
    final List<Thread> workers = new ArrayList<>(workerCount);
    for (int iter = 0; iter < workerCount; iter++) {
      final Thread worker = new Thread(simulationWorker, "test-simulation-worker-" + iter);
      workers.add(worker);
    }
    for (final Thread worker : workers) {
      worker.start();
    }
    for (final Thread worker : workers) {
      worker.join();
    }

    assertEquals(workerCount * 1000, correct.get());
    assertEquals(0, wrong.get());
  }

  private static Dfa<Integer, String> missingOneB() {
    return Dfa.<Integer, String>newBuilder().states(1, 2).alphabet("a", "b").startState(1)
        .finalState(2).transition(1, "a", 2).transition(2, "a", 1).transition(2, "b", 2).build();
  }

  static List<List<String>> allInputs(final List<String> alphabet, final int maxLength) {
    final List<List<String>> inputs = new ArrayList<>();
    List<List<String>> ofLength = Collections.singletonList(Collections.<String>emptyList());
    for (int length = 0; length <= maxLength; length++) {
      inputs.addAll(ofLength);
      final List<List<String>> longer = new ArrayList<>();
      for (final List<String> input : ofLength) {
        for (final String symbol : alphabet) {
          final List<String> next = new ArrayList<>(input);
          next.add(symbol);
          longer.add(next);
        }
      }
      ofLength = longer;
    }
    return inputs;
  }

}
