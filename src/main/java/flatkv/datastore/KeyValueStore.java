package flatkv.datastore;

import flatkv.command.CommandResult;

public interface KeyValueStore {

    CommandResult set(String key, String value);   // insert or overwrite, then persist
    CommandResult get(String key);                 // never mutates
    CommandResult remove(String key);              // persists only when the key was present
    CommandResult print();                         // snapshot listing of every entry

}
