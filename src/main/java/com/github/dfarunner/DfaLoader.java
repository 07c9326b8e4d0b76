package com.github.dfarunner;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.dfarunner.DfaLoadException.Code;

/**
 * Reads YAML DFA documents and turns them into {@link Dfa} instances.
 *
 * States and symbols are bound straight from the scalar text of the document, never through the
 * number or boolean YAML would type them as. A state listed as 01 therefore matches a transition
 * keyed 01 and never one keyed 1, and an alphabet of [yes, no] stays two symbols. Nothing is
 * validated: hand the result to {@link DfaValidator}.
 */
public final class DfaLoader {
  private static final Logger logger = LogManager.getLogger(DfaLoader.class.getSimpleName());

  private static final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public static DfaDocument load(final Path path) throws DfaLoadException {
    try (InputStream stream = Files.newInputStream(path)) {
      final DfaDocument document = load(stream);
      logger.info(String.format("Loaded dfa document %s: %s", path, document.getDescription()));
      return document;
    } catch (IOException problem) {
      throw new DfaLoadException(Code.UNREADABLE_DOCUMENT,
          "Failed to read dfa document " + path, problem);
    }
  }

  public static DfaDocument load(final InputStream stream) throws DfaLoadException {
    try (JsonParser parser = mapper.getFactory().createParser(stream)) {
      // no token at all means there is no document
      final DfaDocument document =
          parser.nextToken() == null ? null : mapper.readValue(parser, DfaDocument.class);
      if (document == null) {
        throw new DfaLoadException(Code.UNREADABLE_DOCUMENT, "DFA document is empty");
      }
      return document;
    } catch (JsonMappingException problem) {
      throw new DfaLoadException(Code.MALFORMED_FIELD, problem.getOriginalMessage(), problem);
    } catch (IOException problem) {
      throw new DfaLoadException(Code.UNREADABLE_DOCUMENT, problem.getMessage(), problem);
    }
  }

  /**
   * Convenience for {@code toDfa(load(path))}.
   */
  public static Dfa<String, String> loadDfa(final Path path) throws DfaLoadException {
    return toDfa(load(path));
  }

  public static Dfa<String, String> toDfa(final DfaDocument document) throws DfaLoadException {
    final Dfa.DfaBuilder<String, String> builder = Dfa.newBuilder();
    builder.states(scalars("states", required("states", document.getStates())));
    builder.alphabet(scalars("alphabet", required("alphabet", document.getAlphabet())));
    builder.startState(scalar("start_state", required("start_state", document.getStartState())));
    builder.finalStates(
        scalars("final_states", required("final_states", document.getFinalStates())));

    final Map<String, Map<String, String>> transitions =
        required("transitions", document.getTransitions());
    for (final Map.Entry<String, Map<String, String>> fromState : transitions.entrySet()) {
      final Map<String, String> symbolToState = fromState.getValue();
      if (symbolToState == null) {
        throw new DfaLoadException(Code.MALFORMED_FIELD, String.format(
            "transitions of state '%s' should map input symbols to states", fromState.getKey()));
      }
      for (final Map.Entry<String, String> transition : symbolToState.entrySet()) {
        builder.transition(fromState.getKey(), transition.getKey(),
            scalar("transitions", transition.getValue()));
      }
    }
    final Dfa<String, String> dfa = builder.build();
    if (logger.isDebugEnabled()) {
      logger.debug("Built " + dfa);
    }
    return dfa;
  }

  /**
   * The document's example strings the dfa must accept, empty if there are none.
   */
  public static List<String> acceptStrings(final DfaDocument document) throws DfaLoadException {
    return inputStrings(document.getAcceptStrings());
  }

  /**
   * The document's example strings the dfa must reject, empty if there are none.
   */
  public static List<String> rejectStrings(final DfaDocument document) throws DfaLoadException {
    return inputStrings(document.getRejectStrings());
  }

  private static List<String> inputStrings(final List<String> values) {
    if (values == null) {
      return Collections.emptyList();
    }
    final List<String> strings = new ArrayList<>(values.size());
    for (final String value : values) {
      // a bare "-" entry is the empty string
      strings.add(value == null ? "" : value);
    }
    return strings;
  }

  private static List<String> scalars(final String field, final List<String> values)
      throws DfaLoadException {
    for (final String value : values) {
      scalar(field, value);
    }
    return values;
  }

  // sequences and mappings in place of a scalar are already refused by the mapper
  private static String scalar(final String field, final String value) throws DfaLoadException {
    if (value == null) {
      throw new DfaLoadException(Code.MALFORMED_FIELD,
          String.format("%s should only hold scalar values, found null", field));
    }
    return value;
  }

  private static <T> T required(final String field, final T value) throws DfaLoadException {
    if (value == null) {
      throw new DfaLoadException(Code.MISSING_FIELD, "DFA document lacks field " + field);
    }
    return value;
  }

  private DfaLoader() {}

}
