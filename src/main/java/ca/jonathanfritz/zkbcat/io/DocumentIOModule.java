package ca.jonathanfritz.zkbcat.io;

import com.google.inject.AbstractModule;

public class DocumentIOModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(StatementDocumentLoader.class).to(PdfBoxDocumentLoader.class);
    }
}
