package io.arbor.internal_api.json;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/** One state of a property sheet description. {@code id} is informational only. */
public final class PropertyStateJson {
  public Integer id;

  @SerializedName("property_set_id")
  public Integer propertySetId;

  public List<PropertyTransitionJson> transitions;

  @SerializedName("default_next_state_id")
  public Integer defaultNextStateId;
}
