/**
 * Marker annotations produced by the legacy MVVM migration recipes.
 * <p>
 * These annotations carry no runtime semantics. They are read by a source generator
 * that synthesizes the observable-property and relay-command boilerplate which the
 * legacy view models used to write by hand:
 * <ul>
 *   <li>{@link com.github.migration.mvvm.ObservableProperty} replaces a setter that calls
 *       {@code onPropertyChanged(..)} or {@code setProperty(..)}</li>
 *   <li>{@link com.github.migration.mvvm.NotifyPropertyChangedFor} replaces notifications
 *       raised for other properties from such a setter</li>
 *   <li>{@link com.github.migration.mvvm.RelayCommand} replaces a lazily created
 *       {@code DelegateCommand} property</li>
 * </ul>
 */
package com.github.migration.mvvm;
