/**
 * Flow model shared by every module.
 *
 * <ul>
 *   <li>{@link com.pyflow.model.Flow} – datasets, recipes, warnings, recommendations and optimization notes</li>
 *   <li>{@link com.pyflow.model.settings} – per-recipe-type settings variants</li>
 *   <li>{@link com.pyflow.model.prepare} – Prepare processor steps and their modes</li>
 *   <li>{@link com.pyflow.model.transform} – analyzer output ({@link com.pyflow.model.transform.Transformation},
 *       {@link com.pyflow.model.transform.DataStep})</li>
 *   <li>{@link com.pyflow.model.graph} – DAG view, cycle detection and validation</li>
 * </ul>
 */
package com.pyflow.model;
