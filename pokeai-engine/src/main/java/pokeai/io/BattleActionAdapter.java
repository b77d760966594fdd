package pokeai.io;

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import pokeai.engine.action.BattleAction;

import java.io.IOException;

/**
 * Actions travel as their notation ("move:earthquake", "switch:2", "pass").
 */
public final class BattleActionAdapter extends TypeAdapter<BattleAction> {

    @Override
    public void write(JsonWriter out, BattleAction action) throws IOException {
        if (action == null) {
            out.nullValue();
            return;
        }
        out.value(action.notation());
    }

    @Override
    public BattleAction read(JsonReader in) throws IOException {
        if (in.peek() == JsonToken.NULL) {
            in.nextNull();
            return null;
        }
        String text = in.nextString();
        try {
            return BattleAction.parse(text);
        } catch (IllegalArgumentException e) {
            throw new JsonParseException("Bad action '" + text + "' at " + in.getPath(), e);
        }
    }
}
