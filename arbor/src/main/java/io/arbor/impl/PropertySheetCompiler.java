package io.arbor.impl;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSyntaxException;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import io.arbor.api.PropertySheet;
import io.arbor.api.PropertySheetException;
import io.arbor.internal_api.json.PropertySheetJson;
import io.arbor.internal_api.json.PropertyStateJson;
import io.arbor.internal_api.json.PropertyTransitionJson;
import io.arbor.tree.Language;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import java.io.IOException;
import java.io.StringReader;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a property sheet description into an indexed state machine.
 *
 * <p>Transition clauses are resolved against the {@link Language}:
 *
 * <ul>
 *   <li>{@code text} patterns are compiled once per sheet, keyed by the literal pattern string;
 *   <li>{@code field} names resolve to field ids, unknown names act as "no field";
 *   <li>{@code type} names resolve to every kind id with that name and the clause's {@code named}
 *       flag. A clause without {@code named} selects no kind.
 * </ul>
 *
 * <p>A clause with a field and a kind is stored in the field bucket with the kind as a filter. A
 * clause with only a kind is stored in the kind bucket, and also, with the kind as a filter, in
 * every field bucket of its state so that a node reached through a field still sees it. Field
 * buckets are created for all fields named in a state before any clause is stored. A clause with
 * only a field is stored unfiltered in the field bucket.
 */
public final class PropertySheetCompiler {
  private static final Logger log = LoggerFactory.getLogger(PropertySheetCompiler.class);

  private final Language language;
  private final List<Pattern> regexes = new ArrayList<>();
  private final Object2IntMap<String> regexIndexes = new Object2IntOpenHashMap<>();

  private PropertySheetCompiler(Language language) {
    this.language = language;
    this.regexIndexes.defaultReturnValue(PropertyTransition.NONE);
  }

  /**
   * Parses and compiles a property sheet description.
   *
   * @param language the grammar the sheet refers to
   * @param json the description
   * @param propertySetType the type property sets are deserialized into
   * @param gson the deserializer
   * @param <P> the property set type
   * @return the compiled sheet
   * @throws PropertySheetException if the description is malformed or contains an invalid regex
   */
  public static <P> PropertySheet<P> compile(
      Language language, String json, Type propertySetType, Gson gson)
      throws PropertySheetException {
    Objects.requireNonNull(language, "language");
    Objects.requireNonNull(json, "json");
    Objects.requireNonNull(propertySetType, "propertySetType");
    Objects.requireNonNull(gson, "gson");

    PropertySheetJson<P> input = parse(json, propertySetType, gson);
    validate(input);
    return new PropertySheetCompiler(language).compile(input);
  }

  /**
   * Reads the description strictly: unquoted names, single-quoted strings, comments and trailing
   * content are rejected.
   */
  private static <P> PropertySheetJson<P> parse(String json, Type propertySetType, Gson gson)
      throws PropertySheetException {
    TypeToken<?> sheetType = TypeToken.getParameterized(PropertySheetJson.class, propertySetType);
    @SuppressWarnings("unchecked")
    TypeAdapter<PropertySheetJson<P>> adapter =
        (TypeAdapter<PropertySheetJson<P>>) gson.getAdapter(sheetType);
    PropertySheetJson<P> input;
    try (JsonReader reader = new JsonReader(new StringReader(json))) {
      reader.setLenient(false);
      input = adapter.read(reader);
      if (reader.peek() != JsonToken.END_DOCUMENT) {
        throw PropertySheetException.invalidJson(
            new JsonSyntaxException("Trailing content at " + reader.getPath()));
      }
    } catch (IOException | IllegalStateException | JsonParseException e) {
      throw PropertySheetException.invalidJson(e);
    }
    if (input == null) {
      throw PropertySheetException.missingMember("states", "$");
    }
    return input;
  }

  private static void validate(PropertySheetJson<?> input) throws PropertySheetException {
    if (input.states == null) {
      throw PropertySheetException.missingMember("states", "$");
    }
    if (input.propertySets == null) {
      throw PropertySheetException.missingMember("property_sets", "$");
    }
    int stateCount = input.states.size();
    int propertySetCount = input.propertySets.size();
    if (stateCount == 0) {
      throw PropertySheetException.invalidSheet(
          "A property sheet needs at least one state", "states");
    }

    for (int i = 0; i < stateCount; i++) {
      PropertyStateJson state = input.states.get(i);
      String location = "states[" + i + "]";
      if (state == null) {
        throw PropertySheetException.invalidSheet("State must be an object", location);
      }
      if (state.propertySetId == null) {
        throw PropertySheetException.missingMember("property_set_id", location);
      }
      if (state.defaultNextStateId == null) {
        throw PropertySheetException.missingMember("default_next_state_id", location);
      }
      if (state.transitions == null) {
        throw PropertySheetException.missingMember("transitions", location);
      }
      checkRange("property_set_id", state.propertySetId, propertySetCount, location);
      checkRange("default_next_state_id", state.defaultNextStateId, stateCount, location);

      for (int j = 0; j < state.transitions.size(); j++) {
        PropertyTransitionJson transition = state.transitions.get(j);
        String transitionLocation = location + ".transitions[" + j + "]";
        if (transition == null) {
          throw PropertySheetException.invalidSheet(
              "Transition must be an object", transitionLocation);
        }
        if (transition.stateId == null) {
          throw PropertySheetException.missingMember("state_id", transitionLocation);
        }
        checkRange("state_id", transition.stateId, stateCount, transitionLocation);
        if (transition.index != null && transition.index < 0) {
          throw PropertySheetException.invalidSheet(
              "Child index must not be negative, got " + transition.index, transitionLocation);
        }
      }
    }
  }

  private static void checkRange(String member, int value, int bound, String location)
      throws PropertySheetException {
    if (value < 0 || value >= bound) {
      throw PropertySheetException.invalidSheet(
          String.format("'%s' is %d but must be in [0, %d)", member, value, bound), location);
    }
  }

  private <P> PropertySheet<P> compile(PropertySheetJson<P> input) throws PropertySheetException {
    PropertyState[] states = new PropertyState[input.states.size()];
    for (int i = 0; i < states.length; i++) {
      states[i] = compileState(input.states.get(i), i);
    }
    if (log.isDebugEnabled()) {
      log.debug(
          "Compiled property sheet: {} states, {} property sets, {} regexes",
          states.length,
          input.propertySets.size(),
          regexes.size());
    }
    return new PropertySheetImpl<>(states, input.propertySets, regexes.toArray(new Pattern[0]));
  }

  private PropertyState compileState(PropertyStateJson state, int stateIndex)
      throws PropertySheetException {
    Long2ObjectMap<List<PropertyTransition>> buckets = new Long2ObjectOpenHashMap<>();
    List<List<PropertyTransition>> fieldBuckets = new ArrayList<>();

    for (PropertyTransitionJson transition : state.transitions) {
      int fieldId = fieldId(transition.field);
      if (fieldId != Language.NO_FIELD) {
        long key = PropertyState.bucketKey(PropertyState.FIELD_BUCKET, fieldId);
        if (!buckets.containsKey(key)) {
          List<PropertyTransition> bucket = new ArrayList<>();
          buckets.put(key, bucket);
          fieldBuckets.add(bucket);
        }
      }
    }

    for (PropertyTransitionJson transition : state.transitions) {
      int regexIndex =
          transition.text != null ? regexIndex(transition.text) : PropertyTransition.NONE;
      int stateId = transition.stateId;
      int childIndex = transition.index != null ? transition.index : PropertyTransition.NONE;
      int fieldId = fieldId(transition.field);
      if (transition.field != null && fieldId == Language.NO_FIELD) {
        log.debug("State {}: ignoring unknown field '{}'", stateIndex, transition.field);
      }

      if (transition.kind != null) {
        boolean resolved = false;
        for (int kindId = 0; kindId < language.nodeKindCount(); kindId++) {
          if (!transition.kind.equals(language.nodeKindForId(kindId))
              || transition.named == null
              || transition.named.booleanValue() != language.nodeKindIsNamed(kindId)) {
            continue;
          }
          resolved = true;
          if (fieldId != Language.NO_FIELD) {
            buckets
                .get(PropertyState.bucketKey(PropertyState.FIELD_BUCKET, fieldId))
                .add(new PropertyTransition(stateId, childIndex, regexIndex, kindId));
          } else {
            for (List<PropertyTransition> bucket : fieldBuckets) {
              bucket.add(new PropertyTransition(stateId, childIndex, regexIndex, kindId));
            }
            long key = PropertyState.bucketKey(PropertyState.KIND_BUCKET, kindId);
            List<PropertyTransition> bucket = buckets.get(key);
            if (bucket == null) {
              bucket = new ArrayList<>();
              buckets.put(key, bucket);
            }
            bucket.add(
                new PropertyTransition(stateId, childIndex, regexIndex, PropertyTransition.NONE));
          }
        }
        if (!resolved) {
          log.debug(
              "State {}: no node kind matches type '{}' with named={}",
              stateIndex,
              transition.kind,
              transition.named);
        }
      } else if (fieldId != Language.NO_FIELD) {
        buckets
            .get(PropertyState.bucketKey(PropertyState.FIELD_BUCKET, fieldId))
            .add(
                new PropertyTransition(
                    stateId, childIndex, regexIndex, PropertyTransition.NONE));
      }
    }

    Long2ObjectMap<PropertyTransition[]> frozen = new Long2ObjectOpenHashMap<>(buckets.size());
    for (Long2ObjectMap.Entry<List<PropertyTransition>> entry : buckets.long2ObjectEntrySet()) {
      frozen.put(entry.getLongKey(), entry.getValue().toArray(new PropertyTransition[0]));
    }
    return new PropertyState(frozen, state.propertySetId, state.defaultNextStateId);
  }

  private int fieldId(String fieldName) {
    return fieldName != null ? language.fieldIdForName(fieldName) : Language.NO_FIELD;
  }

  private int regexIndex(String pattern) throws PropertySheetException {
    int index = regexIndexes.getInt(pattern);
    if (index != PropertyTransition.NONE) {
      return index;
    }
    try {
      regexes.add(Pattern.compile(pattern));
    } catch (PatternSyntaxException e) {
      throw PropertySheetException.invalidRegex(pattern, e);
    }
    index = regexes.size() - 1;
    regexIndexes.put(pattern, index);
    return index;
  }
}
