package de.mirkosertic.docmirror.destination;

public enum ItemType {
    FILE,
    FOLDER
}
