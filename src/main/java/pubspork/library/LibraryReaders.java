package pubspork.library;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class LibraryReaders {

    private final Map<LibraryType, LibraryReader> readers = new EnumMap<>(LibraryType.class);

    @Autowired
    public LibraryReaders(List<LibraryReader> readers) {
        for (LibraryReader reader : readers) {
            this.readers.put(reader.getType(), reader);
        }
    }

    public LibraryReader forType(LibraryType type) {
        LibraryReader reader = this.readers.get(type);
        if (reader == null) {
            throw new IllegalStateException("No reader registered for library type " + type);
        }
        return reader;
    }
}
