package io.arbor.internal_api.json;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * Wire model of a property sheet description, as emitted by property sheet generators.
 *
 * @param <P> the property set type
 */
public final class PropertySheetJson<P> {
  public List<PropertyStateJson> states;

  @SerializedName("property_sets")
  public List<P> propertySets;
}
