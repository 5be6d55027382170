package pubspork.report.service;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import pubspork.beans.RawPublicationBean;
import pubspork.library.LibraryType;
import pubspork.report.LibraryReportBean;
import pubspork.report.LibraryReportRequest;

public interface LibraryReportService {

    LibraryReportBean buildReport(List<RawPublicationBean> library, LibraryType libraryType,
            LibraryReportRequest request, LocalDate reportDate);
    void writeReport(LibraryReportBean report, Path path);

}
