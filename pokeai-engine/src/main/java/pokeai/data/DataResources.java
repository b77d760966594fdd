package pokeai.data;

import java.io.FileNotFoundException;
import java.io.InputStream;

final class DataResources {

    private DataResources() {}

    static InputStream open(String resource) throws FileNotFoundException {
        InputStream in = DataResources.class.getResourceAsStream(resource);
        if (in == null) {
            throw new FileNotFoundException("Missing classpath resource " + resource);
        }
        return in;
    }
}
