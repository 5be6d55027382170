package pubspork.library;

import java.nio.file.Path;
import java.util.List;

import pubspork.beans.RawPublicationBean;

public interface LibraryReader {

    LibraryType getType();

    /**
     * @param path library export file
     * @return every publication in the export, in file order
     * @throws pubspork.model.exception.LibraryReadException if the export cannot be read
     */
    List<RawPublicationBean> read(Path path);

}
